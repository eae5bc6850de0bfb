package com.finfact.pipeline.taxonomy;

import java.util.Locale;
import java.util.Optional;

public enum StatementType {
    BALANCE("balance"),
    INCOME("income"),
    CASH_FLOW("cashflow"),
    EQUITY_CHANGES("equity_changes");

    private final String code;

    StatementType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<StatementType> fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "balance", "balance_sheet" -> Optional.of(BALANCE);
            case "income", "income_statement", "profit" -> Optional.of(INCOME);
            case "cashflow", "cash_flow", "cash_flow_statement" -> Optional.of(CASH_FLOW);
            case "equity_changes", "changes_in_equity" -> Optional.of(EQUITY_CHANGES);
            default -> Optional.empty();
        };
    }
}
