package com.finfact.pipeline.service;

import com.finfact.pipeline.consensus.AgreementStats;
import com.finfact.pipeline.consensus.CandidateObservation;
import com.finfact.pipeline.consensus.ConsensusResolver;
import com.finfact.pipeline.consensus.GroupResolution;
import com.finfact.pipeline.domain.FactCandidateEntity;
import com.finfact.pipeline.domain.ReportVersionEntity;
import com.finfact.pipeline.domain.ResolutionStatus;
import com.finfact.pipeline.domain.ResolvedFactEntity;
import com.finfact.pipeline.domain.VersionStatus;
import com.finfact.pipeline.repository.FactCandidateRepository;
import com.finfact.pipeline.repository.ReportVersionRepository;
import com.finfact.pipeline.repository.ResolvedFactRepository;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ResolutionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResolutionService.class);

    private final ReportVersionRepository reportVersionRepository;
    private final FactCandidateRepository factCandidateRepository;
    private final ResolvedFactRepository resolvedFactRepository;
    private final ConsensusResolver consensusResolver;
    private final ResolvedFactWriter resolvedFactWriter;
    private final FactGroupKeys factGroupKeys;
    private final ReportLockRegistry reportLockRegistry;

    public ResolutionService(
        ReportVersionRepository reportVersionRepository,
        FactCandidateRepository factCandidateRepository,
        ResolvedFactRepository resolvedFactRepository,
        ConsensusResolver consensusResolver,
        ResolvedFactWriter resolvedFactWriter,
        FactGroupKeys factGroupKeys,
        ReportLockRegistry reportLockRegistry
    ) {
        this.reportVersionRepository = reportVersionRepository;
        this.factCandidateRepository = factCandidateRepository;
        this.resolvedFactRepository = resolvedFactRepository;
        this.consensusResolver = consensusResolver;
        this.resolvedFactWriter = resolvedFactWriter;
        this.factGroupKeys = factGroupKeys;
        this.reportLockRegistry = reportLockRegistry;
    }

    public ResolutionOutcome resolve(String reportId, boolean overrideVerified) {
        return reportLockRegistry.runExclusive(reportId, () -> resolveLocked(reportId, overrideVerified));
    }

    private ResolutionOutcome resolveLocked(String reportId, boolean overrideVerified) {
        List<ReportVersionEntity> versions = reportVersionRepository.findLatestTerminal(reportId, VersionStatus.RUNNING);
        List<UUID> versionIds = versions.stream().map(ReportVersionEntity::getVersionId).toList();
        List<FactCandidateEntity> candidates = versionIds.isEmpty()
            ? List.of()
            : factCandidateRepository.findByVersionIdIn(versionIds);

        List<CandidateObservation> observations = candidates.stream().map(factGroupKeys::observe).toList();
        List<GroupResolution> resolutions = consensusResolver.resolve(observations);
        WriteSummary write = resolvedFactWriter.writeAutomatic(reportId, resolutions, overrideVerified);

        Map<ResolutionStatus, Long> byStatus = new EnumMap<>(ResolutionStatus.class);
        resolutions.forEach(resolution -> byStatus.merge(resolution.status(), 1L, Long::sum));
        LOGGER.info("Resolved report {}: {} versions, {} candidates, {} groups {}, write {}",
            reportId, versions.size(), candidates.size(), resolutions.size(), byStatus, write);
        return new ResolutionOutcome(reportId, versions.size(), candidates.size(), resolutions.size(), byStatus, write);
    }

    public List<ResolvedFactEntity> listFacts(String reportId) {
        return resolvedFactRepository.findByReportIdOrderByMetricCodeAscGroupKeyAsc(reportId);
    }

    /**
     * Agreement over multi-engine groups, read from the stored {@code auto_status} and engine
     * counts alone.
     */
    public AgreementStats agreement(String reportId) {
        long multiEngine = resolvedFactRepository.countByReportIdAndEngineCountGreaterThan(reportId, 1);
        long agreed = resolvedFactRepository.countByReportIdAndEngineCountGreaterThanAndAutoStatus(
            reportId, 1, ResolutionStatus.AUTO_AGREED);
        return new AgreementStats(multiEngine, agreed);
    }
}
