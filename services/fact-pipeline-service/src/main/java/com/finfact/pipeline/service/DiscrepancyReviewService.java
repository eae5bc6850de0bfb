package com.finfact.pipeline.service;

import com.finfact.pipeline.candidate.PeriodResolver;
import com.finfact.pipeline.config.PipelineProperties;
import com.finfact.pipeline.domain.ResolutionStatus;
import com.finfact.pipeline.domain.ResolvedFactEntity;
import com.finfact.pipeline.repository.ResolvedFactRepository;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

@Service
public class DiscrepancyReviewService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DiscrepancyReviewService.class);

    private final ResolvedFactRepository resolvedFactRepository;
    private final ResolvedFactWriter resolvedFactWriter;
    private final ReportLockRegistry reportLockRegistry;
    private final PeriodResolver periodResolver;
    private final Duration lockWait;

    public DiscrepancyReviewService(
        ResolvedFactRepository resolvedFactRepository,
        ResolvedFactWriter resolvedFactWriter,
        ReportLockRegistry reportLockRegistry,
        PeriodResolver periodResolver,
        PipelineProperties properties
    ) {
        this.resolvedFactRepository = resolvedFactRepository;
        this.resolvedFactWriter = resolvedFactWriter;
        this.reportLockRegistry = reportLockRegistry;
        this.periodResolver = periodResolver;
        this.lockWait = Duration.ofMillis(Math.max(0, properties.getManualResolutionLockWaitMs()));
    }

    public List<ResolvedFactEntity> list(DiscrepancyQuery query) {
        LocalDate fromDate = null;
        LocalDate toDate = null;
        if (query.fiscalYear() != null) {
            fromDate = periodResolver.yearEnd(query.fiscalYear() - 1).plusDays(1);
            toDate = periodResolver.yearEnd(query.fiscalYear());
        }
        return resolvedFactRepository.searchDiscrepancies(
            ResolutionStatus.UNRESOLVED,
            blankToNull(query.reportId()),
            query.factType(),
            query.status(),
            query.period(),
            fromDate,
            toDate,
            PageRequest.of(0, Math.max(1, Math.min(query.limit(), 500)))
        );
    }

    public ResolvedFactEntity submit(ManualResolution resolution) {
        if (resolution.reviewer() == null || resolution.reviewer().isBlank()) {
            throw new IllegalArgumentException("reviewer must not be blank");
        }
        ResolvedFactEntity fact = reportLockRegistry.runWaiting(resolution.reportId(), lockWait, () ->
            resolvedFactWriter.writeManual(
                resolution.reportId(),
                resolution.factType(),
                resolution.candidateId(),
                resolution.reviewer().trim(),
                resolution.notes()
            ));
        LOGGER.info("Fact {} of report {} verified by {} with candidate {}",
            fact.getGroupKey(), resolution.reportId(), resolution.reviewer(), resolution.candidateId());
        return fact;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
