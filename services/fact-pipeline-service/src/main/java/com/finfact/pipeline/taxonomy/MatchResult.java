package com.finfact.pipeline.taxonomy;

public record MatchResult(
    String metricCode,
    MetricDefinition metric,
    StatementType statementType,
    MatchMethod method,
    String normalizedLabel
) {
    public boolean isMatched() {
        return metric != null;
    }
}
