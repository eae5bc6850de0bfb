package com.finfact.pipeline.taxonomy;

import java.math.BigDecimal;

public enum SignConvention {
    AS_REPORTED,
    NEGATE;

    public BigDecimal apply(BigDecimal value) {
        if (value == null || this == AS_REPORTED) {
            return value;
        }
        return value.negate();
    }
}
