package com.bko.plansolve.protocol;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of event names understood by the gateway. Inbound names that are well-formed
 * but unknown map to {@link #UNRECOGNIZED} and are carried opaquely.
 */
public enum EventType {

    // client -> server
    USER_CREATE_SESSION("user.create_session"),
    USER_MESSAGE("user.message"),
    USER_RESPONSE("user.response"),
    USER_CANCEL("user.cancel"),
    USER_CANCEL_TASK("user.cancel_task"),
    USER_RESTART_TASK("user.restart_task"),
    USER_CANCEL_PLAN("user.cancel_plan"),
    USER_REPLAN("user.replan"),
    USER_SOLVE_TASKS("user.solve_tasks"),
    USER_ACK("user.ack"),
    USER_REQUEST_STATE("user.request_state"),
    USER_RECONNECT_WITH_STATE("user.reconnect_with_state"),

    // planning
    PLAN_START("plan.start"),
    PLAN_COMPLETED("plan.completed"),
    PLAN_CANCELLED("plan.cancelled"),
    PLAN_COERCION_ERROR("plan.coercion_error"),
    PLAN_VALIDATION_ERROR("plan.validation_error"),

    // solving
    SOLVER_START("solver.start"),
    SOLVER_COMPLETED("solver.completed"),
    SOLVER_CANCELLED("solver.cancelled"),
    SOLVER_RESTARTED("solver.restarted"),
    SOLVER_STEP_FAILED("solver.step_failed"),
    SOLVER_RETRY("solver.retry"),

    // aggregation
    AGGREGATE_START("aggregate.start"),
    AGGREGATE_COMPLETED("aggregate.completed"),
    PIPELINE_COMPLETED("pipeline.completed"),

    // agent
    AGENT_SESSION_CREATED("agent.session_created"),
    AGENT_USER_CONFIRM("agent.user_confirm"),
    AGENT_FINAL_ANSWER("agent.final_answer"),
    AGENT_INTERRUPTED("agent.interrupted"),
    AGENT_ERROR("agent.error"),
    AGENT_STATE_EXPORTED("agent.state_exported"),
    AGENT_STATE_RESTORED("agent.state_restored"),

    // connection level
    SYSTEM_CONNECTED("system.connected"),
    SYSTEM_HEARTBEAT("system.heartbeat"),
    SYSTEM_NOTICE("system.notice"),
    SYSTEM_ERROR("system.error"),

    ERROR_VALIDATION("error.validation"),
    ERROR_TIMEOUT("error.timeout"),
    ERROR_EXECUTION("error.execution"),

    UNRECOGNIZED("");

    private static final Map<String, EventType> BY_WIRE_NAME = Arrays.stream(values())
            .filter(type -> type != UNRECOGNIZED)
            .collect(Collectors.toUnmodifiableMap(EventType::wireName, Function.identity()));

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isInbound() {
        return wireName.startsWith("user.");
    }

    public static EventType fromWire(String wireName) {
        if (wireName == null) {
            return UNRECOGNIZED;
        }
        return BY_WIRE_NAME.getOrDefault(wireName, UNRECOGNIZED);
    }
}
