package com.bko.plansolve.repository;

import com.bko.plansolve.entity.TaskRunLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

/**
 * Repository interface for managing {@link TaskRunLog} entities.
 */
public interface TaskRunLogRepository extends JpaRepository<TaskRunLog, UUID> {
}
