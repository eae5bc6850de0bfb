package com.finfact.pipeline.candidate;

import com.finfact.pipeline.domain.FactType;
import java.time.LocalDate;

public record PeriodDescriptor(FactType factType, LocalDate asOfDate, LocalDate periodStart, LocalDate periodEnd) {

    public static PeriodDescriptor stock(LocalDate asOf) {
        return new PeriodDescriptor(FactType.STOCK, asOf, null, null);
    }

    public static PeriodDescriptor flow(LocalDate start, LocalDate end) {
        return new PeriodDescriptor(FactType.FLOW, null, start, end);
    }

    public static PeriodDescriptor unresolved(FactType factType) {
        return new PeriodDescriptor(factType, null, null, null);
    }

    public boolean isResolved() {
        return factType == FactType.STOCK ? asOfDate != null : periodEnd != null;
    }

    /**
     * The date a listing filters on: as-of for stock facts, period end for flow facts.
     */
    public LocalDate referenceDate() {
        return factType == FactType.STOCK ? asOfDate : periodEnd;
    }

    public String asKey() {
        if (!isResolved()) {
            return "unknown";
        }
        if (factType == FactType.STOCK) {
            return asOfDate.toString();
        }
        return (periodStart == null ? "" : periodStart.toString()) + ".." + periodEnd;
    }
}
