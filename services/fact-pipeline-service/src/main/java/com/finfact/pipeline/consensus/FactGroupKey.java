package com.finfact.pipeline.consensus;

import com.finfact.pipeline.domain.FactType;
import java.time.LocalDate;
import java.util.Locale;

/**
 * Identity of a fact across engines. Build instances through {@link #normalized} so that
 * candidates and stored facts compare equal regardless of casing, whitespace or missing
 * currency/unit/scope.
 */
public record FactGroupKey(
    String metricCode,
    FactType factType,
    LocalDate asOfDate,
    LocalDate periodStart,
    LocalDate periodEnd,
    String scope,
    String currency,
    String unit
) {

    public static FactGroupKey normalized(
        String metricCode,
        FactType factType,
        LocalDate asOfDate,
        LocalDate periodStart,
        LocalDate periodEnd,
        String scope,
        String currency,
        String unit,
        Defaults defaults
    ) {
        boolean stock = factType == FactType.STOCK;
        return new FactGroupKey(
            lower(metricCode, ""),
            factType,
            stock ? asOfDate : null,
            stock ? null : periodStart,
            stock ? null : periodEnd,
            lower(scope, defaults.scope()),
            upper(currency, defaults.currency()),
            lower(unit, defaults.unit())
        );
    }

    public boolean hasPeriod() {
        return factType == FactType.STOCK ? asOfDate != null : periodEnd != null;
    }

    /**
     * Stable textual form, stored on resolved facts as {@code group_key}.
     */
    public String asString() {
        String period = factType == FactType.STOCK
            ? iso(asOfDate)
            : iso(periodStart) + ".." + iso(periodEnd);
        return String.join("|", metricCode, factType.name().toLowerCase(Locale.ROOT), period, scope, currency, unit);
    }

    private static String iso(LocalDate date) {
        return date == null ? "" : date.toString();
    }

    private static String lower(String value, String fallback) {
        String chosen = value == null || value.isBlank() ? fallback : value;
        return chosen == null ? "" : chosen.trim().toLowerCase(Locale.ROOT);
    }

    private static String upper(String value, String fallback) {
        String chosen = value == null || value.isBlank() ? fallback : value;
        return chosen == null ? "" : chosen.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Values substituted for a missing currency, unit or scope on both sides of a comparison.
     */
    public record Defaults(String currency, String unit, String scope) {
    }
}
