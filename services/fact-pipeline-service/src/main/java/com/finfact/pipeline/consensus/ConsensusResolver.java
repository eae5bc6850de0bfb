package com.finfact.pipeline.consensus;

import com.finfact.pipeline.config.PipelineProperties;
import com.finfact.pipeline.domain.ResolutionStatus;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Groups candidates from all engines by {@link FactGroupKey} and decides each group's value.
 *
 * <p>Pure: the same candidates always produce the same resolutions, in any input order. Values
 * agree when they differ by no more than the larger of the absolute floor and the relative
 * tolerance times the larger magnitude. Unmatched ({@code raw_}) candidates, candidates
 * without a parsed value and candidates whose period could not be resolved never take part;
 * they stay stored for audit.</p>
 */
@Component
public class ConsensusResolver {

    private final BigDecimal relativeTolerance;
    private final BigDecimal absoluteTolerance;
    private final int minAgreeingEngines;
    private final ColumnPriority columnPriority;

    public ConsensusResolver(PipelineProperties properties) {
        PipelineProperties.Consensus settings = properties.getConsensus();
        this.relativeTolerance = BigDecimal.valueOf(settings.getRelativeTolerance());
        this.absoluteTolerance = BigDecimal.valueOf(settings.getAbsoluteTolerance());
        this.minAgreeingEngines = Math.max(2, settings.getMinAgreeingEngines());
        this.columnPriority = new ColumnPriority(settings.getCurrentPeriodLabels(), settings.getPriorPeriodLabels());
    }

    public List<GroupResolution> resolve(Collection<CandidateObservation> observations) {
        Map<String, List<CandidateObservation>> groups = new LinkedHashMap<>();
        observations.stream()
            .filter(obs -> obs.matched() && obs.value() != null && obs.key().hasPeriod())
            .sorted(Comparator.comparing((CandidateObservation obs) -> obs.key().asString())
                .thenComparing(obs -> obs.candidateId().toString()))
            .forEach(obs -> groups.computeIfAbsent(obs.key().asString(), ignored -> new ArrayList<>()).add(obs));

        List<GroupResolution> resolutions = new ArrayList<>(groups.size());
        groups.values().forEach(members -> resolutions.add(resolveGroup(members)));
        return resolutions;
    }

    GroupResolution resolveGroup(List<CandidateObservation> members) {
        FactGroupKey key = members.get(0).key();
        Set<String> engines = members.stream().map(CandidateObservation::engine).collect(Collectors.toCollection(TreeSet::new));

        if (engines.size() == 1) {
            CandidateObservation best = best(members);
            return new GroupResolution(key, ResolutionStatus.AUTO_SINGLE_ENGINE, best.value(), best.candidateId(),
                1, 1, members.size());
        }

        List<CandidateObservation> topCluster = null;
        int topEngines = 0;
        for (CandidateObservation center : members) {
            List<CandidateObservation> cluster = members.stream()
                .filter(other -> agrees(center.value(), other.value()))
                .toList();
            int clusterEngines = (int) cluster.stream().map(CandidateObservation::engine).distinct().count();
            if (topCluster == null || clusterEngines > topEngines
                || (clusterEngines == topEngines && preference().compare(best(cluster), best(topCluster)) < 0)) {
                topCluster = cluster;
                topEngines = clusterEngines;
            }
        }

        if (topEngines >= minAgreeingEngines) {
            CandidateObservation chosen = best(topCluster);
            return new GroupResolution(key, ResolutionStatus.AUTO_AGREED, chosen.value(), chosen.candidateId(),
                engines.size(), topEngines, members.size());
        }
        CandidateObservation provisional = best(members);
        return new GroupResolution(key, ResolutionStatus.UNRESOLVED, provisional.value(), provisional.candidateId(),
            engines.size(), topEngines, members.size());
    }

    boolean agrees(BigDecimal a, BigDecimal b) {
        BigDecimal magnitude = a.abs().max(b.abs());
        BigDecimal tolerance = absoluteTolerance.max(magnitude.multiply(relativeTolerance));
        return a.subtract(b).abs().compareTo(tolerance) <= 0;
    }

    private CandidateObservation best(List<CandidateObservation> candidates) {
        return candidates.stream().min(preference()).orElseThrow();
    }

    // most preferred first: column priority, then quality, then a stable id order
    private Comparator<CandidateObservation> preference() {
        return Comparator.comparing(CandidateObservation::columnLabel, columnPriority.preferred())
            .thenComparing(Comparator.comparingDouble(CandidateObservation::quality).reversed())
            .thenComparing(obs -> obs.candidateId().toString());
    }
}
