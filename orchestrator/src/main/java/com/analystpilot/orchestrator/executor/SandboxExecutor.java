package com.analystpilot.orchestrator.executor;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Runs model-generated Python scripts in isolated containers.
 *
 * <p>For each {@link #execute} call:
 * <ol>
 *   <li>Provision the session if it has no environment yet: fresh workspace
 *       directory, manifest files copied in, new container bound to that
 *       workspace only.</li>
 *   <li>Join the fragments (newest last) into {@code script.py} in the workspace.</li>
 *   <li>Install third-party imports found by the {@link ImportScanner};
 *       install failures are logged and the script runs anyway.</li>
 *   <li>Run the script with a wall-clock timeout.</li>
 *   <li>Tear the environment down unless the caller keeps it open. Timeouts
 *       and errors always tear down.</li>
 * </ol>
 *
 * No exception escapes {@code execute}; every failure becomes an
 * {@link ExecutionResult} the model can read and react to.
 */
public class SandboxExecutor {

    private static final Logger log = LoggerFactory.getLogger(SandboxExecutor.class);

    static final String SCRIPT_NAME = "script.py";

    private final ContainerRuntime runtime;
    private final ImportScanner    importScanner;
    private final Path             workspaceRoot;
    private final String           image;
    private final Duration         executionTimeout;
    private final Duration         installTimeout;
    private final MeterRegistry    meterRegistry;

    // Live session handles, keyed by id, so shutdown can drain anything abandoned.
    private final Map<String, SandboxSession> sessions = new ConcurrentHashMap<>();

    public SandboxExecutor(ContainerRuntime runtime,
                           ImportScanner importScanner,
                           Path workspaceRoot,
                           String image,
                           Duration executionTimeout,
                           Duration installTimeout,
                           MeterRegistry meterRegistry) {
        this.runtime          = runtime;
        this.importScanner    = importScanner;
        this.workspaceRoot    = workspaceRoot;
        this.image            = image;
        this.executionTimeout = executionTimeout;
        this.installTimeout   = installTimeout;
        this.meterRegistry    = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Session lifecycle
    // ------------------------------------------------------------------

    /**
     * Open a session handle for the given attempt. Nothing is provisioned
     * until the first {@link #execute}.
     *
     * @param manifest file name → host path of every file the scripts may read
     */
    public SandboxSession openSession(String sessionId, Map<String, Path> manifest) {
        SandboxSession session = new SandboxSession(sessionId, manifest);
        SandboxSession previous = sessions.putIfAbsent(sessionId, session);
        if (previous != null) {
            throw new IllegalStateException("Sandbox session already open: " + sessionId);
        }
        log.debug("Opened sandbox session {}", sessionId);
        return session;
    }

    /** Tear down whatever the session holds and forget it. */
    public void close(SandboxSession session) {
        session.lock().lock();
        try {
            teardown(session);
        } finally {
            session.lock().unlock();
            sessions.remove(session.id(), session);
        }
    }

    /** Number of session handles not yet closed. */
    public int openSessionCount() {
        return sessions.size();
    }

    /** Drain every open session; called on application shutdown. */
    public void shutdown() {
        for (SandboxSession session : new ArrayList<>(sessions.values())) {
            log.info("Closing abandoned sandbox session {}", session.id());
            close(session);
        }
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    /**
     * One-shot execution: a throwaway session that is always torn down.
     */
    public ExecutionResult execute(List<String> fragments, Map<String, Path> manifest) {
        SandboxSession session = openSession("oneshot-" + UUID.randomUUID(), manifest);
        try {
            return execute(session, fragments, false);
        } finally {
            close(session);
        }
    }

    /**
     * Run the fragments as one script inside the session's environment.
     *
     * @param keepSessionOpen keep container and workspace for the next call;
     *                        ignored (torn down anyway) on timeout or error
     */
    public ExecutionResult execute(SandboxSession session, List<String> fragments, boolean keepSessionOpen) {
        if (fragments == null || fragments.isEmpty()) {
            return ExecutionResult.failed("No code to execute");
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "error";
        session.lock().lock();
        try {
            if (!session.isActive()) {
                provision(session);
            }
            session.running();

            String script = String.join("\n\n", fragments);
            Files.writeString(session.workspace().resolve(SCRIPT_NAME), script, StandardCharsets.UTF_8);

            installDependencies(session, script);

            log.info("Executing script in sandbox {} (container {})", session.id(), session.containerId());
            ContainerRuntime.ExecOutput out =
                    runtime.exec(session.containerId(), List.of("python", SCRIPT_NAME), executionTimeout);

            if (out.timedOut()) {
                log.error("Script in sandbox {} timed out after {} s", session.id(), executionTimeout.toSeconds());
                teardown(session);
                status = "timeout";
                return ExecutionResult.timedOut();
            }

            ExecutionResult result = ExecutionResult.completed(out.exitCode(), out.stdout(), out.stderr());
            status = result.success() ? "success" : "script_error";
            if (keepSessionOpen) {
                session.idle();
            } else {
                teardown(session);
            }
            return result;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Execution in sandbox {} interrupted", session.id());
            teardown(session);
            return ExecutionResult.failed("Execution interrupted");
        } catch (Exception e) {
            log.error("Execution in sandbox {} failed: {}", session.id(), e.getMessage(), e);
            teardown(session);
            return ExecutionResult.failed(e.getMessage() != null ? e.getMessage() : e.toString());
        } finally {
            session.lock().unlock();
            sample.stop(meterRegistry.timer("analyst.sandbox.duration"));
            meterRegistry.counter("analyst.sandbox.executions", "status", status).increment();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void provision(SandboxSession session) throws IOException {
        Files.createDirectories(workspaceRoot);
        Path workspace = Files.createTempDirectory(workspaceRoot, "sandbox_");
        session.provisioning(workspace);
        log.info("Provisioning sandbox {} in {}", session.id(), workspace);

        for (Map.Entry<String, Path> file : session.manifest().entrySet()) {
            Path target = workspace.resolve(file.getKey()).normalize();
            if (!target.startsWith(workspace)) {
                throw new ExecutorException("Manifest entry escapes the workspace: " + file.getKey());
            }
            Files.copy(file.getValue(), target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Copied {} -> {}", file.getValue(), target);
        }

        String containerName = "sandbox_" + UUID.randomUUID().toString().substring(0, 8);
        session.attached(runtime.start(containerName, image, workspace));
    }

    private void installDependencies(SandboxSession session, String script) throws InterruptedException {
        Set<String> wanted = new LinkedHashSet<>(importScanner.thirdPartyPackages(script));
        wanted.removeAll(session.installedPackages());
        if (wanted.isEmpty()) {
            return;
        }

        log.info("Installing packages {} in sandbox {}", wanted, session.id());
        List<String> cmd = new ArrayList<>(List.of("pip", "install", "--no-cache-dir"));
        cmd.addAll(wanted);
        try {
            ContainerRuntime.ExecOutput out = runtime.exec(session.containerId(), cmd, installTimeout);
            if (out.timedOut()) {
                log.warn("pip install {} timed out in sandbox {}", wanted, session.id());
            } else if (out.exitCode() != 0) {
                log.warn("pip install {} exited {} in sandbox {}: {}",
                        wanted, out.exitCode(), session.id(), out.stderr().strip());
            } else {
                session.recordInstalled(wanted);
            }
        } catch (ExecutorException e) {
            // The script's own ImportError will tell the model what is missing.
            log.warn("pip install {} failed in sandbox {}: {}", wanted, session.id(), e.getMessage());
        }
    }

    /** Stop and remove the container, delete the workspace. Never throws. */
    private void teardown(SandboxSession session) {
        String containerId = session.containerId();
        Path   workspace   = session.workspace();
        if (containerId != null) {
            try {
                runtime.stop(containerId);
            } catch (Exception e) {
                log.warn("Could not stop container {}: {}", containerId, e.getMessage());
            }
            try {
                runtime.remove(containerId);
            } catch (Exception e) {
                log.warn("Could not remove container {}: {}", containerId, e.getMessage());
            }
        }
        if (workspace != null) {
            try {
                deleteRecursively(workspace);
                log.info("Removed sandbox workspace {}", workspace);
            } catch (IOException | UncheckedIOException e) {
                log.warn("Could not delete workspace {}: {}", workspace, e.getMessage());
            }
        }
        if (containerId != null || workspace != null) {
            session.terminated();
        }
    }

    static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) return;
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path p : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }
}
