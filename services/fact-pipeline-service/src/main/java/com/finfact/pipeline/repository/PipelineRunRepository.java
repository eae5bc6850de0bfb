package com.finfact.pipeline.repository;

import com.finfact.pipeline.domain.PipelineRunEntity;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PipelineRunRepository extends JpaRepository<PipelineRunEntity, UUID> {
}
