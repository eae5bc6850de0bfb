package com.finfact.pipeline.service;

import com.finfact.pipeline.domain.FactType;
import java.util.UUID;

public record ManualResolution(String reportId, FactType factType, UUID candidateId, String reviewer, String notes) {
}
