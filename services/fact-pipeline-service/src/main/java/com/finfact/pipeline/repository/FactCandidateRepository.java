package com.finfact.pipeline.repository;

import com.finfact.pipeline.domain.FactCandidateEntity;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FactCandidateRepository extends JpaRepository<FactCandidateEntity, UUID> {

    List<FactCandidateEntity> findByVersionIdIn(Collection<UUID> versionIds);

    Optional<FactCandidateEntity> findByIdAndReportId(UUID id, String reportId);
}
