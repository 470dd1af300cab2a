package com.analystpilot.orchestrator.agent;

import com.analystpilot.orchestrator.executor.ExecutionResult;

/**
 * One completed code iteration of an attempt: what the model said and what
 * happened when its code ran. Lives only as long as the attempt.
 */
public record IterationRecord(int iteration, String modelOutput, ExecutionResult execution) {

    /** Block appended to the history section of the next prompt. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Iteration ").append(iteration).append('\n');
        sb.append("Model output:\n").append(modelOutput).append("\n\n");
        sb.append("Execution Results:\n");
        sb.append(execution == null ? "(not executed)" : execution.toObservation());
        sb.append('\n');
        return sb.toString();
    }
}
