package com.finfact.pipeline.consistency;

import com.finfact.pipeline.config.PipelineProperties;
import com.finfact.pipeline.domain.ResolutionStatus;
import com.finfact.pipeline.support.UnitScale;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Evaluates {@link AccountingIdentity accounting identities} over resolved facts, once per
 * (scope, date). An identity is skipped when its result or any required operand is missing.
 * Unresolved facts never take part since their value is only provisional.
 */
@Component
public class ConsistencyChecker {

    private final BigDecimal absoluteTolerance;
    private final BigDecimal relativeTolerance;
    private final List<AccountingIdentity> identities;

    public ConsistencyChecker(PipelineProperties properties) {
        this(properties, AccountingIdentity.STANDARD);
    }

    ConsistencyChecker(PipelineProperties properties, List<AccountingIdentity> identities) {
        this.absoluteTolerance = BigDecimal.valueOf(properties.getConsistency().getAbsoluteTolerance());
        this.relativeTolerance = BigDecimal.valueOf(properties.getConsistency().getRelativeTolerance());
        this.identities = List.copyOf(identities);
    }

    public List<ConsistencyCheckResult> check(Collection<FactValue> facts) {
        Map<String, Map<String, FactValue>> bySlice = new TreeMap<>();
        for (FactValue fact : facts) {
            if (fact.status() == ResolutionStatus.UNRESOLVED || fact.value() == null || fact.date() == null
                || "percent".equals(fact.unit())) {
                continue;
            }
            Map<String, FactValue> slice = bySlice.computeIfAbsent(fact.scope() + "|" + fact.date(), ignored -> new HashMap<>());
            slice.merge(fact.metricCode(), fact, ConsistencyChecker::preferVerified);
        }

        List<ConsistencyCheckResult> results = new ArrayList<>();
        for (Map<String, FactValue> slice : bySlice.values()) {
            FactValue any = slice.values().iterator().next();
            for (AccountingIdentity identity : identities) {
                evaluate(identity, any.scope(), any.date(), slice).ifPresent(results::add);
            }
        }
        results.sort(Comparator.comparing(ConsistencyCheckResult::scope)
            .thenComparing(ConsistencyCheckResult::date)
            .thenComparing(ConsistencyCheckResult::name));
        return results;
    }

    private Optional<ConsistencyCheckResult> evaluate(
        AccountingIdentity identity,
        String scope,
        LocalDate date,
        Map<String, FactValue> slice
    ) {
        FactValue result = slice.get(identity.resultMetric());
        if (result == null) {
            return Optional.empty();
        }
        BigDecimal rhs = BigDecimal.ZERO;
        for (AccountingIdentity.Operand operand : identity.operands()) {
            Optional<FactValue> value = operand.alternatives().stream().map(slice::get).filter(v -> v != null).findFirst();
            if (value.isEmpty()) {
                if (operand.optional()) {
                    continue;
                }
                return Optional.empty();
            }
            rhs = rhs.add(toBase(value.get()));
        }
        BigDecimal lhs = toBase(result);
        BigDecimal residual = lhs.subtract(rhs);
        BigDecimal tolerance = absoluteTolerance.max(lhs.abs().max(rhs.abs()).multiply(relativeTolerance));
        return Optional.of(new ConsistencyCheckResult(
            identity.name(), scope, date, identity.formula(), lhs, rhs, residual,
            residual.abs().compareTo(tolerance) <= 0
        ));
    }

    private static BigDecimal toBase(FactValue fact) {
        return UnitScale.fromCode(fact.unit()).toBase(fact.value());
    }

    private static FactValue preferVerified(FactValue existing, FactValue incoming) {
        return existing.status() != ResolutionStatus.VERIFIED && incoming.status() == ResolutionStatus.VERIFIED
            ? incoming
            : existing;
    }
}
