package com.finfact.pipeline.repository;

import com.finfact.pipeline.domain.ExtractionFailureEntity;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ExtractionFailureRepository extends JpaRepository<ExtractionFailureEntity, UUID> {

    List<ExtractionFailureEntity> findTop20ByRunIdOrderByCreatedAtDesc(UUID runId);
}
