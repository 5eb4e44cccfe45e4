package com.bko.plansolve.orchestration.api;

import com.bko.plansolve.orchestration.model.PipelineTrace;

/**
 * Append-only destination for finished pipeline runs.
 */
public interface TraceSink {

    /**
     * Stores a trace. Failures must not propagate to the caller.
     *
     * @param trace The finished run.
     */
    void append(PipelineTrace trace);
}
