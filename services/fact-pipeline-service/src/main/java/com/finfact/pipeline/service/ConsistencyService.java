package com.finfact.pipeline.service;

import com.finfact.pipeline.consistency.ConsistencyCheckResult;
import com.finfact.pipeline.consistency.ConsistencyChecker;
import com.finfact.pipeline.consistency.FactValue;
import com.finfact.pipeline.repository.ResolvedFactRepository;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class ConsistencyService {

    private final ResolvedFactRepository resolvedFactRepository;
    private final ConsistencyChecker consistencyChecker;

    public ConsistencyService(ResolvedFactRepository resolvedFactRepository, ConsistencyChecker consistencyChecker) {
        this.resolvedFactRepository = resolvedFactRepository;
        this.consistencyChecker = consistencyChecker;
    }

    public List<ConsistencyCheckResult> check(String reportId) {
        List<FactValue> facts = resolvedFactRepository.findByReportIdOrderByMetricCodeAscGroupKeyAsc(reportId).stream()
            .map(fact -> new FactValue(
                fact.getMetricCode(),
                fact.getScope(),
                fact.referenceDate(),
                fact.getUnit(),
                fact.getValue(),
                fact.getStatus()
            ))
            .toList();
        return consistencyChecker.check(facts);
    }
}
