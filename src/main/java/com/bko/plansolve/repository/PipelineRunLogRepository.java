package com.bko.plansolve.repository;

import com.bko.plansolve.entity.PipelineRunLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

/**
 * Repository interface for managing {@link PipelineRunLog} entities.
 */
public interface PipelineRunLogRepository extends JpaRepository<PipelineRunLog, UUID> {
}
