package com.finfact.pipeline.candidate;

import com.finfact.pipeline.taxonomy.StatementType;
import java.util.List;

public record TableCandidates(
    List<FactCandidate> candidates,
    int distinctMetrics,
    boolean accepted,
    int unmatchedRows,
    int labelledRows,
    StatementType statementType
) {
    public TableCandidates {
        candidates = List.copyOf(candidates);
    }

    public static TableCandidates rejected(int distinctMetrics, int unmatchedRows, int labelledRows, StatementType statementType) {
        return new TableCandidates(List.of(), distinctMetrics, false, unmatchedRows, labelledRows, statementType);
    }
}
