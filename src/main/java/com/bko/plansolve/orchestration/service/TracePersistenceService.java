package com.bko.plansolve.orchestration.service;

import com.bko.plansolve.entity.PipelineRunLog;
import com.bko.plansolve.entity.TaskRunLog;
import com.bko.plansolve.orchestration.api.TraceSink;
import com.bko.plansolve.orchestration.model.PipelineTrace;
import com.bko.plansolve.orchestration.model.TaskOutcome;
import com.bko.plansolve.repository.PipelineRunLogRepository;
import com.bko.plansolve.repository.TaskRunLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Stores finished runs in the relational trace tables. Storage failures are logged and dropped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TracePersistenceService implements TraceSink {

    private final PipelineRunLogRepository runLogRepository;
    private final TaskRunLogRepository taskRunLogRepository;

    @Override
    public void append(PipelineTrace trace) {
        try {
            PipelineRunLog run = runLogRepository.save(PipelineRunLog.builder()
                    .sessionId(trace.sessionId())
                    .question(trace.question())
                    .planSummary(trace.planSummary())
                    .status(trace.status())
                    .finalAnswer(trace.finalAnswer())
                    .taskCount(trace.outcomes().size())
                    .startedAt(toOffset(trace.startedAt()))
                    .finishedAt(toOffset(trace.finishedAt()))
                    .build());
            List<TaskRunLog> tasks = trace.outcomes().stream()
                    .map(outcome -> toTaskLog(run, outcome))
                    .toList();
            if (!tasks.isEmpty()) {
                taskRunLogRepository.saveAll(tasks);
            }
            log.debug("Stored trace of session {} with status {} ({} tasks)",
                    trace.sessionId(), trace.status(), tasks.size());
        } catch (DataAccessException ex) {
            log.warn("Failed to store trace of session {}: {}", trace.sessionId(), ex.getMessage());
        }
    }

    private static TaskRunLog toTaskLog(PipelineRunLog run, TaskOutcome outcome) {
        return TaskRunLog.builder()
                .run(run)
                .taskId(outcome.task().id())
                .title(outcome.task().title())
                .state(outcome.state().name())
                .attempts(outcome.attempts())
                .output(outcome.output())
                .error(outcome.error())
                .build();
    }

    private static @Nullable OffsetDateTime toOffset(@Nullable Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }
}
