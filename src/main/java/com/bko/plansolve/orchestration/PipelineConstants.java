package com.bko.plansolve.orchestration;

public final class PipelineConstants {

    private PipelineConstants() {
        // Private constructor to prevent instantiation
    }

    // LLM Request Purposes
    public static final String PURPOSE_PLAN = "plan";
    public static final String PURPOSE_PLAN_RETRY = "plan-retry";
    public static final String PURPOSE_SOLVE = "solve";
    public static final String PURPOSE_AGGREGATE = "aggregate";

    public static final String INVALID_JSON_RETRY_PROMPT = "\nYour last response was invalid JSON. Return only valid JSON.";
    public static final String NO_OUTPUT = "(no output)";

    public static final String PLANNER_SYSTEM_PROMPT = """
            You are the planner of a plan-solve-aggregate pipeline.
            Split the user request into at most %d independent sections that can be solved in parallel.
            Order the sections the way they should appear in the final report.
            Return only JSON with this schema:
            {
              "summary": "1-2 sentences describing the plan",
              "tasks": [
                {"title": "...", "objective": "what this section must deliver", "inputs": ["..."], "hints": ["..."]}
              ]
            }
            """;

    public static final String PLANNER_USER_TEMPLATE = """
            User request:
            {question}
            """;

    public static final String SOLVER_SYSTEM_PROMPT = """
            You solve one section of a larger report.
            Stay within the section objective; other sections are written in parallel by other workers.
            Return the section content as plain Markdown without a leading title.
            """;

    public static final String SOLVER_USER_TEMPLATE = """
            Overall request:
            {question}

            Plan summary:
            {summary}

            Section {taskId}: {title}
            Objective: {objective}
            Inputs: {inputs}
            Hints: {hints}
            """;

    public static final String AGGREGATOR_SYSTEM_PROMPT = """
            You compose the final report from independently solved sections.
            Keep the section order, remove repetition and add a short introduction and conclusion.
            Sections that failed or were cancelled must be listed as gaps rather than invented.
            Return only JSON with this schema:
            {
              "summary": "1-3 sentences",
              "report": "the full report in Markdown"
            }
            """;

    public static final String AGGREGATOR_USER_TEMPLATE = """
            Overall request:
            {question}

            Sections:
            {sections}
            """;
}
