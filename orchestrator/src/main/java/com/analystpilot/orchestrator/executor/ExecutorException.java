package com.analystpilot.orchestrator.executor;

/**
 * Thrown when the container runtime is unreachable or a lifecycle verb
 * (create, start, exec) fails. Caught by {@link SandboxExecutor}, which tears
 * the session down and reports the failure as an {@link ExecutionResult}.
 */
public class ExecutorException extends RuntimeException {

    public ExecutorException(String message) {
        super(message);
    }

    public ExecutorException(String message, Throwable cause) {
        super(message, cause);
    }
}
