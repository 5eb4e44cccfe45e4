package com.bko.plansolve.orchestration.service;

import com.bko.plansolve.entity.PipelineRunLog;
import com.bko.plansolve.entity.TaskRunLog;
import com.bko.plansolve.orchestration.model.PipelineTrace;
import com.bko.plansolve.orchestration.model.TaskOutcome;
import com.bko.plansolve.orchestration.model.TaskSpec;
import com.bko.plansolve.orchestration.model.TaskState;
import com.bko.plansolve.repository.PipelineRunLogRepository;
import com.bko.plansolve.repository.TaskRunLogRepository;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TracePersistenceServiceTest {

    private final PipelineRunLogRepository runLogRepository = mock(PipelineRunLogRepository.class);
    private final TaskRunLogRepository taskRunLogRepository = mock(TaskRunLogRepository.class);
    private final TracePersistenceService service = new TracePersistenceService(runLogRepository, taskRunLogRepository);

    private static PipelineTrace trace(List<TaskOutcome> outcomes) {
        return new PipelineTrace("s-1", "question", "summary", "completed", "answer", outcomes,
                Instant.parse("2026-01-01T00:00:00Z"), Instant.parse("2026-01-01T00:01:00Z"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testStoresRunAndTasks() {
        when(runLogRepository.save(any(PipelineRunLog.class))).thenAnswer(invocation -> invocation.getArgument(0));
        TaskSpec spec = new TaskSpec(1, "Intro", "Write intro", List.of(), List.of());

        service.append(trace(List.of(
                new TaskOutcome(spec, TaskState.SUCCEEDED, "text", null, 1),
                new TaskOutcome(new TaskSpec(2, "Body", "Write body", List.of(), List.of()), TaskState.FAILED, null, "boom", 2))));

        ArgumentCaptor<PipelineRunLog> run = ArgumentCaptor.forClass(PipelineRunLog.class);
        verify(runLogRepository).save(run.capture());
        assertEquals("s-1", run.getValue().getSessionId());
        assertEquals("completed", run.getValue().getStatus());
        assertEquals(2, run.getValue().getTaskCount());
        assertEquals(Instant.parse("2026-01-01T00:01:00Z"), run.getValue().getFinishedAt().toInstant());

        ArgumentCaptor<List<TaskRunLog>> tasks = ArgumentCaptor.forClass(List.class);
        verify(taskRunLogRepository).saveAll(tasks.capture());
        assertEquals(2, tasks.getValue().size());
        assertEquals("FAILED", tasks.getValue().get(1).getState());
        assertEquals("boom", tasks.getValue().get(1).getError());
        assertSame(run.getValue(), tasks.getValue().get(0).getRun());
    }

    @Test
    void testRunWithoutTasksSkipsTaskRows() {
        when(runLogRepository.save(any(PipelineRunLog.class))).thenAnswer(invocation -> invocation.getArgument(0));

        service.append(trace(List.of()));

        verify(taskRunLogRepository, never()).saveAll(anyList());
    }

    @Test
    void testStorageFailureIsNotPropagated() {
        when(runLogRepository.save(any(PipelineRunLog.class))).thenThrow(new DataAccessResourceFailureException("db down"));

        assertDoesNotThrow(() -> service.append(trace(List.of())));
    }
}
