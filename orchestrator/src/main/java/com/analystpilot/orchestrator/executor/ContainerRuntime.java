package com.analystpilot.orchestrator.executor;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Lifecycle verbs of a container-style runtime, as used by the sandbox.
 *
 * The only implementation talks to Docker; tests substitute an in-memory fake.
 */
public interface ContainerRuntime {

    /** Output of one command run inside a container. */
    record ExecOutput(int exitCode, String stdout, String stderr, boolean timedOut) {

        public static ExecOutput timeout(String stdoutSoFar, String stderrSoFar) {
            return new ExecOutput(-1, stdoutSoFar, stderrSoFar, true);
        }
    }

    /**
     * Create and start a long-lived container from {@code image} with
     * {@code workspace} mounted read/write at {@link #WORKSPACE_MOUNT}.
     *
     * @return the container id
     * @throws ExecutorException if the container cannot be created or started
     */
    String start(String name, String image, Path workspace);

    /**
     * Run a command inside a started container with {@link #WORKSPACE_MOUNT}
     * as working directory, waiting at most {@code timeout}.
     *
     * @throws ExecutorException    on runtime errors (not on non-zero exit)
     * @throws InterruptedException if the waiting thread is interrupted
     */
    ExecOutput exec(String containerId, List<String> command, Duration timeout) throws InterruptedException;

    /** Stop the container; a container that is already gone is not an error. */
    void stop(String containerId);

    /** Remove the container; a container that is already gone is not an error. */
    void remove(String containerId);

    String WORKSPACE_MOUNT = "/workspace";
}
