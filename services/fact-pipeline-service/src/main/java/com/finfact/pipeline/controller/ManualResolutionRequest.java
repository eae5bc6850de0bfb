package com.finfact.pipeline.controller;

import com.finfact.pipeline.domain.FactType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;

public record ManualResolutionRequest(
    @NotBlank(message = "reportId must not be blank")
    String reportId,

    @NotNull
    FactType factType,

    @NotNull
    UUID candidateId,

    @NotBlank(message = "reviewer must not be blank")
    String reviewer,

    @Size(max = 2000)
    String notes
) {
}
