package com.finfact.pipeline.taxonomy;

public record MatchRequest(String label, StatementType tableStatementType, String backgroundRuleCode) {

    public static MatchRequest of(String label, StatementType tableStatementType) {
        return new MatchRequest(label, tableStatementType, null);
    }
}
