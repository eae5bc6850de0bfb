package com.finfact.pipeline.service;

import com.finfact.pipeline.config.PipelineProperties;
import com.finfact.pipeline.consensus.CandidateObservation;
import com.finfact.pipeline.consensus.FactGroupKey;
import com.finfact.pipeline.domain.FactCandidateEntity;
import org.springframework.stereotype.Component;

@Component
public class FactGroupKeys {

    private final FactGroupKey.Defaults defaults;

    public FactGroupKeys(PipelineProperties properties) {
        PipelineProperties.Candidates candidates = properties.getCandidates();
        this.defaults = new FactGroupKey.Defaults(
            candidates.getDefaultCurrency(), candidates.getDefaultUnit(), candidates.getDefaultScope());
    }

    public FactGroupKey keyOf(FactCandidateEntity candidate) {
        return FactGroupKey.normalized(
            candidate.getMetricCode(),
            candidate.getFactType(),
            candidate.getAsOfDate(),
            candidate.getPeriodStart(),
            candidate.getPeriodEnd(),
            candidate.getScope(),
            candidate.getCurrency(),
            candidate.getUnit(),
            defaults
        );
    }

    public CandidateObservation observe(FactCandidateEntity candidate) {
        return new CandidateObservation(
            candidate.getId(),
            candidate.getEngine(),
            keyOf(candidate),
            candidate.getValue(),
            candidate.getColumnLabel(),
            candidate.getQuality(),
            candidate.isMatched()
        );
    }
}
