package com.bko.plansolve.orchestration.api;

import com.bko.plansolve.orchestration.model.AggregateReport;
import com.bko.plansolve.orchestration.model.PlanContext;
import com.bko.plansolve.orchestration.model.TaskOutcome;

import java.util.List;

/**
 * Composes the final artifact once every task is terminal.
 */
public interface Aggregator {

    /**
     * Aggregates task outcomes.
     *
     * @param context The plan that was executed.
     * @param outcomes One outcome per task in task-id order, including failed and cancelled tasks.
     * @return The composed report.
     */
    AggregateReport aggregate(PlanContext context, List<TaskOutcome> outcomes);
}
