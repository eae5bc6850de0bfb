package com.finfact.pipeline.domain;

public enum FactType {
    STOCK,
    FLOW
}
