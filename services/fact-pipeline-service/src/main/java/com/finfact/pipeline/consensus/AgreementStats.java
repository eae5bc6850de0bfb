package com.finfact.pipeline.consensus;

public record AgreementStats(long multiEngineGroups, long agreedGroups) {

    public double rate() {
        return multiEngineGroups == 0 ? 0.0 : (double) agreedGroups / multiEngineGroups;
    }
}
