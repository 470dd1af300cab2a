package com.analystpilot.orchestrator.executor;

import java.nio.file.Path;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Handle to one isolated execution environment and its workspace.
 *
 * <p>A session is opened per feedback-loop attempt and passed explicitly to
 * {@link SandboxExecutor#execute}. The container and workspace behind it are
 * provisioned lazily on the first execution and may be torn down and
 * re-provisioned later; the handle itself stays valid until
 * {@link SandboxExecutor#close} is called.
 *
 * <pre>
 *   NEW -> PROVISIONING -> RUNNING -> IDLE (kept open) -> RUNNING -> ...
 *                                  \-> TERMINATED (torn down) -> PROVISIONING -> ...
 * </pre>
 *
 * All mutation happens under {@link #lock()}, held by the executor for the
 * whole of an execution, so two callers can never interleave on one workspace.
 */
public class SandboxSession {

    public enum State { NEW, PROVISIONING, RUNNING, IDLE, TERMINATED }

    private final String            id;
    private final Map<String, Path> manifest;
    private final ReentrantLock     lock = new ReentrantLock();

    private State       state = State.NEW;
    private Path        workspace;
    private String      containerId;
    private final Set<String> installedPackages = new HashSet<>();

    SandboxSession(String id, Map<String, Path> manifest) {
        this.id       = id;
        this.manifest = Map.copyOf(manifest);
    }

    public String id()                  { return id; }
    public Map<String, Path> manifest() { return manifest; }
    public Path workspace()             { return workspace; }
    public String containerId()         { return containerId; }
    public State state()                { return state; }

    /** True while a container and workspace are provisioned. */
    public boolean isActive() {
        return containerId != null;
    }

    Set<String> installedPackages() {
        return Collections.unmodifiableSet(installedPackages);
    }

    ReentrantLock lock() { return lock; }

    // ------------------------------------------------------------------
    // Transitions (executor only)
    // ------------------------------------------------------------------

    void provisioning(Path workspace) {
        this.state     = State.PROVISIONING;
        this.workspace = workspace;
    }

    void attached(String containerId) {
        this.containerId = containerId;
        this.state       = State.IDLE;
    }

    void running()  { this.state = State.RUNNING; }

    void idle()     { this.state = State.IDLE; }

    void recordInstalled(Set<String> packages) {
        installedPackages.addAll(packages);
    }

    void terminated() {
        this.state       = State.TERMINATED;
        this.workspace   = null;
        this.containerId = null;
        installedPackages.clear();
    }

    @Override
    public String toString() {
        return "SandboxSession[id=%s, state=%s, container=%s]".formatted(id, state, containerId);
    }
}
