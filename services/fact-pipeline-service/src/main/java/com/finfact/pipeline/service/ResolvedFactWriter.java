package com.finfact.pipeline.service;

import com.finfact.pipeline.consensus.FactGroupKey;
import com.finfact.pipeline.consensus.GroupResolution;
import com.finfact.pipeline.domain.FactCandidateEntity;
import com.finfact.pipeline.domain.FactType;
import com.finfact.pipeline.domain.ResolutionStatus;
import com.finfact.pipeline.domain.ResolvedFactEntity;
import com.finfact.pipeline.domain.UpsertResult;
import com.finfact.pipeline.repository.FactCandidateRepository;
import com.finfact.pipeline.repository.ResolvedFactRepository;
import jakarta.transaction.Transactional;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.springframework.stereotype.Service;

/**
 * Transactional writes of resolved facts. Callers hold the report lock.
 */
@Service
public class ResolvedFactWriter {

    private final ResolvedFactRepository resolvedFactRepository;
    private final FactCandidateRepository factCandidateRepository;
    private final FactGroupKeys factGroupKeys;

    public ResolvedFactWriter(
        ResolvedFactRepository resolvedFactRepository,
        FactCandidateRepository factCandidateRepository,
        FactGroupKeys factGroupKeys
    ) {
        this.resolvedFactRepository = resolvedFactRepository;
        this.factCandidateRepository = factCandidateRepository;
        this.factGroupKeys = factGroupKeys;
    }

    /**
     * Upserts the automatic resolutions of a report. Unchanged rows are not touched, verified
     * rows are kept unless {@code overrideVerified} is set, and automatic facts whose group no
     * longer exists are removed.
     */
    @Transactional
    public WriteSummary writeAutomatic(String reportId, List<GroupResolution> resolutions, boolean overrideVerified) {
        Map<String, ResolvedFactEntity> existing = new HashMap<>();
        resolvedFactRepository.findByReportIdOrderByMetricCodeAscGroupKeyAsc(reportId)
            .forEach(fact -> existing.put(fact.getGroupKey(), fact));

        int inserted = 0;
        int updated = 0;
        int unchanged = 0;
        int skipped = 0;
        Set<String> seen = new HashSet<>();
        for (GroupResolution resolution : resolutions) {
            String groupKey = resolution.key().asString();
            seen.add(groupKey);
            UpsertResult result = upsert(reportId, existing.get(groupKey), resolution, overrideVerified);
            switch (result) {
                case INSERTED -> inserted++;
                case UPDATED -> updated++;
                case UNCHANGED -> unchanged++;
                case SKIPPED_VERIFIED -> skipped++;
            }
        }

        int deleted = 0;
        for (ResolvedFactEntity fact : existing.values()) {
            if (!seen.contains(fact.getGroupKey()) && fact.getStatus() != ResolutionStatus.VERIFIED) {
                resolvedFactRepository.delete(fact);
                deleted++;
            }
        }
        return new WriteSummary(inserted, updated, unchanged, skipped, deleted);
    }

    private UpsertResult upsert(String reportId, ResolvedFactEntity current, GroupResolution resolution, boolean overrideVerified) {
        if (current == null) {
            resolvedFactRepository.save(ResolvedFactEntity.fromResolution(reportId, resolution));
            return UpsertResult.INSERTED;
        }
        if (current.getStatus() == ResolutionStatus.VERIFIED && !overrideVerified) {
            return UpsertResult.SKIPPED_VERIFIED;
        }
        if (!current.hasChanged(resolution)) {
            return UpsertResult.UNCHANGED;
        }
        current.applyResolution(resolution);
        resolvedFactRepository.save(current);
        return UpsertResult.UPDATED;
    }

    /**
     * Marks the group of {@code candidateId} as verified with that candidate's value.
     */
    @Transactional
    public ResolvedFactEntity writeManual(String reportId, FactType factType, UUID candidateId, String reviewer, String notes) {
        FactCandidateEntity candidate = factCandidateRepository.findByIdAndReportId(candidateId, reportId)
            .orElseThrow(() -> new IllegalArgumentException("Candidate " + candidateId + " not found for report " + reportId));
        if (candidate.getFactType() != factType) {
            throw new IllegalArgumentException("Candidate " + candidateId + " is a " + candidate.getFactType() + " fact, not " + factType);
        }
        if (!candidate.isMatched() || candidate.getValue() == null) {
            throw new IllegalArgumentException("Candidate " + candidateId + " has no canonical metric or no parsed value");
        }
        FactGroupKey key = factGroupKeys.keyOf(candidate);
        ResolvedFactEntity fact = resolvedFactRepository.findByReportIdAndGroupKey(reportId, key.asString())
            .orElseThrow(() -> new IllegalArgumentException("No resolved fact for group " + key.asString()));
        fact.verify(candidate.getId(), candidate.getValue(), reviewer, notes);
        return resolvedFactRepository.save(fact);
    }
}
