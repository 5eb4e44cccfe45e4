package com.bko.plansolve.orchestration.llm;

import com.bko.plansolve.orchestration.api.Aggregator;
import com.bko.plansolve.orchestration.model.AggregateReport;
import com.bko.plansolve.orchestration.model.PlanContext;
import com.bko.plansolve.orchestration.model.TaskOutcome;
import com.bko.plansolve.orchestration.model.TaskState;
import com.bko.plansolve.orchestration.service.JsonProcessingService;
import com.bko.plansolve.orchestration.service.PipelineMetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Objects;

import static com.bko.plansolve.orchestration.PipelineConstants.AGGREGATOR_SYSTEM_PROMPT;
import static com.bko.plansolve.orchestration.PipelineConstants.AGGREGATOR_USER_TEMPLATE;
import static com.bko.plansolve.orchestration.PipelineConstants.NO_OUTPUT;
import static com.bko.plansolve.orchestration.PipelineConstants.PURPOSE_AGGREGATE;

@Component
@RequiredArgsConstructor
@Slf4j
public class ChatClientAggregator implements Aggregator {

    private final ChatClient chatClient;
    private final JsonProcessingService jsonProcessingService;
    private final PipelineMetricsService metricsService;

    @Override
    public AggregateReport aggregate(PlanContext context, List<TaskOutcome> outcomes) {
        String sections = renderSections(outcomes);
        metricsService.recordLlmRequest(PURPOSE_AGGREGATE);
        String response = chatClient.prompt()
                .system(AGGREGATOR_SYSTEM_PROMPT)
                .user(user -> user.text(AGGREGATOR_USER_TEMPLATE)
                        .param("question", Objects.toString(context.question(), ""))
                        .param("sections", sections))
                .call()
                .content();
        AggregateReport report = jsonProcessingService.parseJsonResponse(PURPOSE_AGGREGATE, response, AggregateReport.class);
        if (report != null && StringUtils.hasText(report.content())) {
            return report;
        }
        log.warn("Aggregator response for session {} was not a report; concatenating sections", context.sessionId());
        return concatenate(context, outcomes);
    }

    static AggregateReport concatenate(PlanContext context, List<TaskOutcome> outcomes) {
        StringBuilder body = new StringBuilder();
        for (TaskOutcome outcome : outcomes) {
            body.append("## ").append(outcome.task().id()).append(". ").append(outcome.task().title()).append("\n\n");
            if (outcome.state() == TaskState.SUCCEEDED) {
                body.append(StringUtils.hasText(outcome.output()) ? outcome.output() : NO_OUTPUT);
            } else {
                body.append("_Section ").append(outcome.state().name().toLowerCase()).append(": ")
                        .append(Objects.toString(outcome.error(), NO_OUTPUT)).append("_");
            }
            body.append("\n\n");
        }
        long succeeded = outcomes.stream().filter(o -> o.state() == TaskState.SUCCEEDED).count();
        String summary = "%d of %d sections completed".formatted(succeeded, outcomes.size());
        return new AggregateReport(summary, body.toString().trim());
    }

    private static String renderSections(List<TaskOutcome> outcomes) {
        StringBuilder sections = new StringBuilder();
        for (TaskOutcome outcome : outcomes) {
            sections.append("### Section ").append(outcome.task().id()).append(": ").append(outcome.task().title())
                    .append(" [").append(outcome.state().name()).append("]\n");
            if (outcome.state() == TaskState.SUCCEEDED) {
                sections.append(Objects.toString(outcome.output(), NO_OUTPUT));
            } else {
                sections.append("Not available: ").append(Objects.toString(outcome.error(), outcome.state().name()));
            }
            sections.append("\n\n");
        }
        return sections.toString();
    }
}
