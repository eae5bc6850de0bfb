package com.finfact.pipeline.service;

import java.nio.file.Path;
import java.util.List;

public record PipelineRunCommand(
    String reportId,
    Path source,
    Integer fiscalYear,
    List<String> engines,
    boolean overrideVerified
) {
    public PipelineRunCommand {
        engines = engines == null ? List.of() : List.copyOf(engines);
    }
}
