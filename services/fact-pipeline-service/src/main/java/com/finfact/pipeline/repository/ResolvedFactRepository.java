package com.finfact.pipeline.repository;

import com.finfact.pipeline.domain.FactType;
import com.finfact.pipeline.domain.ResolutionStatus;
import com.finfact.pipeline.domain.ResolvedFactEntity;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ResolvedFactRepository extends JpaRepository<ResolvedFactEntity, UUID> {

    List<ResolvedFactEntity> findByReportIdOrderByMetricCodeAscGroupKeyAsc(String reportId);

    Optional<ResolvedFactEntity> findByReportIdAndGroupKey(String reportId, String groupKey);

    long countByReportIdAndEngineCountGreaterThan(String reportId, int engineCount);

    long countByReportIdAndEngineCountGreaterThanAndAutoStatus(String reportId, int engineCount, ResolutionStatus autoStatus);

    long countByReportIdAndStatus(String reportId, ResolutionStatus status);

    /**
     * Facts whose automatic resolution ended in disagreement, whether or not reviewed since.
     */
    @Query("""
        select f from ResolvedFactEntity f
        where f.autoStatus = :disputed
          and (:reportId is null or f.reportId = :reportId)
          and (:factType is null or f.factType = :factType)
          and (:status is null or f.status = :status)
          and (:period is null or f.asOfDate = :period or f.periodEnd = :period)
          and (:fromDate is null or f.asOfDate >= :fromDate or f.periodEnd >= :fromDate)
          and (:toDate is null or f.asOfDate <= :toDate or f.periodEnd <= :toDate)
        order by f.reportId, f.metricCode, f.groupKey
        """)
    List<ResolvedFactEntity> searchDiscrepancies(
        @Param("disputed") ResolutionStatus disputed,
        @Param("reportId") String reportId,
        @Param("factType") FactType factType,
        @Param("status") ResolutionStatus status,
        @Param("period") LocalDate period,
        @Param("fromDate") LocalDate fromDate,
        @Param("toDate") LocalDate toDate,
        Pageable pageable
    );
}
