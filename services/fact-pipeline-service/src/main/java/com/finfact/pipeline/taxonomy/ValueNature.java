package com.finfact.pipeline.taxonomy;

public enum ValueNature {
    STOCK,
    FLOW,
    RATIO
}
