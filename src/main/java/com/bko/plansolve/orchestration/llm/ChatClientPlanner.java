package com.bko.plansolve.orchestration.llm;

import com.bko.plansolve.config.PlanSolveProperties;
import com.bko.plansolve.error.ValidationException;
import com.bko.plansolve.orchestration.api.Planner;
import com.bko.plansolve.orchestration.model.PlanRequest;
import com.bko.plansolve.orchestration.model.PlanResult;
import com.bko.plansolve.orchestration.model.TaskSpec;
import com.bko.plansolve.orchestration.service.JsonProcessingService;
import com.bko.plansolve.orchestration.service.PipelineMetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

import static com.bko.plansolve.orchestration.PipelineConstants.INVALID_JSON_RETRY_PROMPT;
import static com.bko.plansolve.orchestration.PipelineConstants.PLANNER_SYSTEM_PROMPT;
import static com.bko.plansolve.orchestration.PipelineConstants.PLANNER_USER_TEMPLATE;
import static com.bko.plansolve.orchestration.PipelineConstants.PURPOSE_PLAN;
import static com.bko.plansolve.orchestration.PipelineConstants.PURPOSE_PLAN_RETRY;

@Component
@RequiredArgsConstructor
@Slf4j
public class ChatClientPlanner implements Planner {

    private final ChatClient chatClient;
    private final JsonProcessingService jsonProcessingService;
    private final PipelineMetricsService metricsService;
    private final PlanSolveProperties properties;

    @Override
    public PlanResult plan(PlanRequest request) {
        int maxTasks = properties.getLlm().getMaxTasks();
        String systemPrompt = PLANNER_SYSTEM_PROMPT.formatted(maxTasks);
        metricsService.recordLlmRequest(PURPOSE_PLAN);
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(user -> user.text(PLANNER_USER_TEMPLATE)
                        .param("question", request.question()))
                .call()
                .content();
        PlanDraft draft = jsonProcessingService.parseJsonResponse(PURPOSE_PLAN, response, PlanDraft.class, "tasks");
        if (draft == null) {
            String retryPrompt = systemPrompt + INVALID_JSON_RETRY_PROMPT;
            metricsService.recordLlmRequest(PURPOSE_PLAN_RETRY);
            String retryResponse = chatClient.prompt()
                    .system(retryPrompt)
                    .user(user -> user.text(PLANNER_USER_TEMPLATE)
                            .param("question", request.question()))
                    .call()
                    .content();
            draft = jsonProcessingService.parseJsonResponse(PURPOSE_PLAN_RETRY, retryResponse, PlanDraft.class, "tasks");
        }
        if (draft == null) {
            throw new ValidationException("Planner returned no parsable plan");
        }
        return toResult(draft, maxTasks);
    }

    private PlanResult toResult(PlanDraft draft, int maxTasks) {
        List<TaskSpec> tasks = new ArrayList<>();
        List<PlanDraft.TaskDraft> drafts = draft.tasks() != null ? draft.tasks() : List.of();
        for (PlanDraft.TaskDraft task : drafts) {
            if (task == null) {
                continue;
            }
            String objective = StringUtils.hasText(task.objective()) ? task.objective() : task.description();
            String title = StringUtils.hasText(task.title()) ? task.title() : objective;
            if (!StringUtils.hasText(title)) {
                continue;
            }
            if (tasks.size() == maxTasks) {
                log.warn("Planner returned {} tasks; keeping the first {}", drafts.size(), maxTasks);
                break;
            }
            tasks.add(new TaskSpec(tasks.size() + 1, title.trim(),
                    StringUtils.hasText(objective) ? objective.trim() : title.trim(), task.inputs(), task.hints()));
        }
        return new PlanResult(draft.summary(), tasks);
    }
}
