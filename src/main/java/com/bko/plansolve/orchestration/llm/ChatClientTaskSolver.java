package com.bko.plansolve.orchestration.llm;

import com.bko.plansolve.error.TaskExecutionException;
import com.bko.plansolve.orchestration.api.TaskSolver;
import com.bko.plansolve.orchestration.model.CancellationToken;
import com.bko.plansolve.orchestration.model.PlanContext;
import com.bko.plansolve.orchestration.model.TaskResult;
import com.bko.plansolve.orchestration.model.TaskSpec;
import com.bko.plansolve.orchestration.service.PipelineMetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Objects;

import static com.bko.plansolve.orchestration.PipelineConstants.PURPOSE_SOLVE;
import static com.bko.plansolve.orchestration.PipelineConstants.SOLVER_SYSTEM_PROMPT;
import static com.bko.plansolve.orchestration.PipelineConstants.SOLVER_USER_TEMPLATE;

@Component
@RequiredArgsConstructor
@Slf4j
public class ChatClientTaskSolver implements TaskSolver {

    private final ChatClient chatClient;
    private final PipelineMetricsService metricsService;

    @Override
    public TaskResult solve(TaskSpec task, PlanContext context, CancellationToken cancellationToken) {
        cancellationToken.throwIfCancelled();
        metricsService.recordLlmRequest(PURPOSE_SOLVE);
        String output;
        try {
            output = chatClient.prompt()
                    .system(SOLVER_SYSTEM_PROMPT)
                    .user(user -> user.text(SOLVER_USER_TEMPLATE)
                            .param("question", Objects.toString(context.question(), ""))
                            .param("summary", Objects.toString(context.planSummary(), ""))
                            .param("taskId", task.id())
                            .param("title", task.title())
                            .param("objective", task.objective())
                            .param("inputs", join(task.inputs()))
                            .param("hints", join(task.hints())))
                    .call()
                    .content();
        } catch (RuntimeException ex) {
            log.warn("Solver call for task {} of session {} failed: {}", task.id(), context.sessionId(), ex.getMessage());
            throw new TaskExecutionException("Model call failed: " + ex.getMessage(), true, ex);
        }
        cancellationToken.throwIfCancelled();
        if (!StringUtils.hasText(output)) {
            throw new TaskExecutionException("Model returned an empty section");
        }
        return new TaskResult(output.trim());
    }

    private static String join(List<String> values) {
        return values.isEmpty() ? "none" : String.join("; ", values);
    }
}
