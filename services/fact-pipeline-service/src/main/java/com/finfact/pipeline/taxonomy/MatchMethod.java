package com.finfact.pipeline.taxonomy;

public enum MatchMethod {
    EXACT,
    AFFIX,
    NONE
}
