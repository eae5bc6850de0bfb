package com.finfact.pipeline.support;

import java.math.BigDecimal;
import java.util.Locale;

public enum UnitScale {
    ONE("1", BigDecimal.ONE),
    THOUSAND("1k", new BigDecimal("1000")),
    TEN_THOUSAND("10k", new BigDecimal("10000")),
    MILLION("1m", new BigDecimal("1000000")),
    HUNDRED_MILLION("100m", new BigDecimal("100000000")),
    PERCENT("percent", BigDecimal.ONE);

    private final String code;
    private final BigDecimal multiplier;

    UnitScale(String code, BigDecimal multiplier) {
        this.code = code;
        this.multiplier = multiplier;
    }

    public String code() {
        return code;
    }

    public BigDecimal toBase(BigDecimal value) {
        return value.multiply(multiplier);
    }

    public static UnitScale fromCode(String code) {
        String normalized = code == null ? "" : code.trim().toLowerCase(Locale.ROOT);
        for (UnitScale scale : values()) {
            if (scale.code.equals(normalized)) {
                return scale;
            }
        }
        return ONE;
    }
}
