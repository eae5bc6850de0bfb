package com.finfact.pipeline.candidate;

import java.util.UUID;

public record BuildContext(String reportId, UUID versionId, Integer fiscalYear) {
}
