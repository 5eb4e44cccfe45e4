package com.bko.plansolve.orchestration.api;

import com.bko.plansolve.orchestration.model.PlanRequest;
import com.bko.plansolve.orchestration.model.PlanResult;

/**
 * Produces the ordered task list for a user request.
 */
public interface Planner {

    /**
     * Plans the work for a request.
     *
     * @param request The session and question to plan for.
     * @return The plan summary and its tasks, numbered from 1 in execution order.
     */
    PlanResult plan(PlanRequest request);
}
