package com.finfact.pipeline.service;

import com.finfact.pipeline.domain.ResolutionStatus;
import java.util.Map;

public record ResolutionOutcome(
    String reportId,
    int versionsConsidered,
    int candidatesConsidered,
    int groups,
    Map<ResolutionStatus, Long> groupsByStatus,
    WriteSummary write
) {
}
