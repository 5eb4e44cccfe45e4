package com.bko.plansolve.orchestration.llm;

import com.bko.plansolve.config.PlanSolveProperties;
import com.bko.plansolve.error.ValidationException;
import com.bko.plansolve.orchestration.model.PlanRequest;
import com.bko.plansolve.orchestration.model.PlanResult;
import com.bko.plansolve.orchestration.service.JsonProcessingService;
import com.bko.plansolve.orchestration.service.PipelineMetricsService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;

import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ChatClientPlannerTest {

    private final ChatClient chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
    private final PipelineMetricsService metrics = new PipelineMetricsService();
    private final PlanSolveProperties properties = new PlanSolveProperties();
    private final ChatClientPlanner planner = new ChatClientPlanner(chatClient,
            new JsonProcessingService(new ObjectMapper()), metrics, properties);

    @SuppressWarnings("unchecked")
    private void respond(String first, String... more) {
        when(chatClient.prompt().system(anyString()).user(any(Consumer.class)).call().content()).thenReturn(first, more);
    }

    @Test
    void testNumbersTasksInOrder() {
        respond("""
                {"summary":"Two parts","tasks":[
                  {"title":"Background","objective":"Explain the context","inputs":["docs"]},
                  {"title":"Proposal","description":"Describe the change"}]}
                """);

        PlanResult plan = planner.plan(new PlanRequest("s-1", "Write a design doc"));

        assertEquals("Two parts", plan.summary());
        assertEquals(2, plan.tasks().size());
        assertEquals(1, plan.tasks().get(0).id());
        assertEquals(2, plan.tasks().get(1).id());
        assertEquals("Describe the change", plan.tasks().get(1).objective());
        assertEquals(1, metrics.llmRequests());
    }

    @Test
    void testRetriesOnceAfterInvalidJson() {
        respond("Sure! Here is a plan.", "{\"summary\":\"ok\",\"tasks\":[{\"title\":\"Only\"}]}");

        PlanResult plan = planner.plan(new PlanRequest("s-1", "Question"));

        assertEquals(1, plan.tasks().size());
        assertEquals("Only", plan.tasks().get(0).objective());
        assertEquals(2, metrics.llmRequests());
    }

    @Test
    void testAcceptsBareTaskArray() {
        respond("[{\"title\":\"Data\",\"hints\":[\"use tables\"]},{\"title\":\"Charts\"}]");

        PlanResult plan = planner.plan(new PlanRequest("s-1", "Question"));

        assertNull(plan.summary());
        assertEquals(2, plan.tasks().size());
        assertEquals(List.of("use tables"), plan.tasks().get(0).hints());
    }

    @Test
    void testFailsWhenRetryIsAlsoInvalid() {
        respond("no json", "still no json");

        assertThrows(ValidationException.class, () -> planner.plan(new PlanRequest("s-1", "Question")));
    }

    @Test
    void testCapsTaskCount() {
        properties.getLlm().setMaxTasks(2);
        respond("{\"tasks\":[{\"title\":\"a\"},{\"title\":\"b\"},{\"title\":\"c\"}]}");

        PlanResult plan = planner.plan(new PlanRequest("s-1", "Question"));

        assertEquals(2, plan.tasks().size());
        assertEquals("b", plan.tasks().get(1).title());
    }
}
