package com.finfact.pipeline.controller;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.List;

public record PipelineRunRequest(
    @NotBlank(message = "reportId must not be blank")
    String reportId,

    String sourcePath,

    @Min(1900)
    @Max(2100)
    Integer fiscalYear,

    List<String> engines,

    Boolean overrideVerified
) {
}
