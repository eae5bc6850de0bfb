package com.finfact.pipeline.candidate;

import java.util.Locale;
import java.util.Optional;

public enum ConsolidationScope {
    CONSOLIDATED("consolidated"),
    PARENT("parent");

    private final String code;

    ConsolidationScope(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<ConsolidationScope> fromCode(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ConsolidationScope scope : values()) {
            if (scope.code.equals(normalized)) {
                return Optional.of(scope);
            }
        }
        return Optional.empty();
    }

    /**
     * Scope stated in free text: {@code 母公司} or "parent company" means parent, {@code 合并} or
     * "consolidated" means consolidated.
     */
    public static Optional<ConsolidationScope> fromText(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        if (lowered.contains("母公司") || lowered.contains("parent company")) {
            return Optional.of(PARENT);
        }
        if (lowered.contains("合并") || lowered.contains("consolidated")) {
            return Optional.of(CONSOLIDATED);
        }
        return Optional.empty();
    }
}
