package com.finfact.pipeline.repository;

import com.finfact.pipeline.domain.ReportVersionEntity;
import com.finfact.pipeline.domain.VersionStatus;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ReportVersionRepository extends JpaRepository<ReportVersionEntity, UUID> {

    /**
     * Newest terminal version of every engine that extracted the report.
     */
    @Query("""
        select v from ReportVersionEntity v
        where v.reportId = :reportId
          and v.status <> :running
          and v.completedAt = (
            select max(o.completedAt) from ReportVersionEntity o
            where o.reportId = v.reportId and o.engine = v.engine and o.status <> :running
          )
        order by v.engine
        """)
    List<ReportVersionEntity> findLatestTerminal(
        @Param("reportId") String reportId,
        @Param("running") VersionStatus running
    );

    List<ReportVersionEntity> findByRunIdOrderByEngine(UUID runId);
}
