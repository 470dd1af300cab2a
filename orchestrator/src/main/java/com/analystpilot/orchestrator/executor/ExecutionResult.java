package com.analystpilot.orchestrator.executor;

/**
 * Outcome of running one script in a sandbox session.
 *
 * @param success  true when the script exited with status 0
 * @param stdout   captured standard output, trimmed
 * @param stderr   captured standard error, trimmed; carries the failure reason
 *                 when the script never ran
 * @param exitCode process exit status, or null if the script never finished
 */
public record ExecutionResult(
        boolean success,
        String  stdout,
        String  stderr,
        Integer exitCode
) {
    public static final String TIMEOUT_MESSAGE = "Execution timed out.";

    public static ExecutionResult completed(int exitCode, String stdout, String stderr) {
        return new ExecutionResult(exitCode == 0, strip(stdout), strip(stderr), exitCode);
    }

    public static ExecutionResult timedOut() {
        return new ExecutionResult(false, "", TIMEOUT_MESSAGE, null);
    }

    public static ExecutionResult failed(String reason) {
        return new ExecutionResult(false, "", reason, null);
    }

    /**
     * Format as the observation the model reads on its next turn.
     */
    public String toObservation() {
        StringBuilder sb = new StringBuilder();
        sb.append("success: ").append(success);
        if (stdout != null && !stdout.isBlank()) {
            sb.append("\nstdout:\n").append(stdout);
        }
        if (stderr != null && !stderr.isBlank()) {
            sb.append("\nstderr:\n").append(stderr);
        }
        if (exitCode != null) {
            sb.append("\nexit_code: ").append(exitCode);
        }
        return sb.toString();
    }

    private static String strip(String s) {
        return s == null ? "" : s.strip();
    }
}
