package com.finfact.pipeline.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

public class LocalRunReportStorage implements RunReportStorage {

    private final Path basePath;

    public LocalRunReportStorage(Path basePath) {
        this.basePath = basePath;
    }

    @Override
    public String store(String reportId, UUID runId, String reportJson) {
        try {
            Files.createDirectories(basePath);
            String safeFileName = reportId.replaceAll("[^A-Za-z0-9._-]", "_") + "__" + runId + ".json";
            Path target = basePath.resolve(safeFileName);
            Files.writeString(target, reportJson, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            return target.toAbsolutePath().toString();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to store run report", e);
        }
    }
}
