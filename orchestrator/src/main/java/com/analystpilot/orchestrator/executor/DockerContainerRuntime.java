package com.analystpilot.orchestrator.executor;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Volume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link ContainerRuntime} backed by the Docker Engine API.
 *
 * <p>Each sandbox gets one idle container ({@code bash} on a TTY, so it stays
 * up) with the session workspace bind-mounted at /workspace. Scripts and
 * dependency installs run in it through exec, so installed packages survive
 * across the iterations that share the session.
 */
public class DockerContainerRuntime implements ContainerRuntime {

    private static final Logger log = LoggerFactory.getLogger(DockerContainerRuntime.class);

    private static final int STOP_GRACE_SECONDS = 2;

    private final DockerClient docker;
    private final Duration     pullTimeout;

    public DockerContainerRuntime(DockerClient docker, Duration pullTimeout) {
        this.docker      = docker;
        this.pullTimeout = pullTimeout;
    }

    @Override
    public String start(String name, String image, Path workspace) {
        String containerId = null;
        try {
            ensureImage(image);

            HostConfig hostConfig = HostConfig.newHostConfig()
                    .withBinds(new Bind(workspace.toAbsolutePath().toString(),
                            new Volume(WORKSPACE_MOUNT), AccessMode.rw))
                    .withNetworkMode("bridge");

            containerId = docker.createContainerCmd(image)
                    .withName(name)
                    .withHostConfig(hostConfig)
                    .withWorkingDir(WORKSPACE_MOUNT)
                    .withTty(true)
                    .withStdinOpen(true)
                    .withCmd("bash")
                    .exec()
                    .getId();
            docker.startContainerCmd(containerId).exec();
            log.info("Sandbox container {} started ({}) with workspace {}", name, containerId, workspace);
            return containerId;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutorException("Interrupted while pulling image " + image, e);
        } catch (DockerException | IllegalArgumentException e) {
            if (containerId != null) {
                removeAfterFailedStart(containerId);
            }
            throw new ExecutorException("Could not start sandbox container " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public ExecOutput exec(String containerId, List<String> command, Duration timeout) throws InterruptedException {
        String execId;
        try {
            execId = docker.execCreateCmd(containerId)
                    .withAttachStdout(true)
                    .withAttachStderr(true)
                    .withCmd(command.toArray(new String[0]))
                    .exec()
                    .getId();
        } catch (DockerException e) {
            throw new ExecutorException("exec create failed in " + containerId + ": " + e.getMessage(), e);
        }

        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        ResultCallback.Adapter<Frame> callback;
        try {
            callback = docker.execStartCmd(execId)
                    .exec(new ResultCallback.Adapter<>() {
                        @Override
                        public void onNext(Frame frame) {
                            // Frames can split a multibyte character; decode once at the end.
                            switch (frame.getStreamType()) {
                                case STDERR -> stderr.writeBytes(frame.getPayload());
                                default     -> stdout.writeBytes(frame.getPayload());
                            }
                        }
                    });
        } catch (DockerException e) {
            throw new ExecutorException("exec start failed in " + containerId + ": " + e.getMessage(), e);
        }

        boolean finished;
        try {
            finished = callback.awaitCompletion(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } finally {
            closeQuietly(callback);
        }
        if (!finished) {
            log.warn("Command {} in container {} exceeded {} s", command, containerId, timeout.toSeconds());
            return ExecOutput.timeout(decode(stdout), decode(stderr));
        }

        Long exitCode;
        try {
            exitCode = docker.inspectExecCmd(execId).exec().getExitCodeLong();
        } catch (DockerException e) {
            throw new ExecutorException("exec inspect failed in " + containerId + ": " + e.getMessage(), e);
        }
        return new ExecOutput(exitCode == null ? -1 : exitCode.intValue(),
                decode(stdout), decode(stderr), false);
    }

    @Override
    public void stop(String containerId) {
        try {
            docker.stopContainerCmd(containerId).withTimeout(STOP_GRACE_SECONDS).exec();
        } catch (NotFoundException | NotModifiedException e) {
            log.debug("Container {} already stopped or gone", containerId);
        }
    }

    @Override
    public void remove(String containerId) {
        try {
            docker.removeContainerCmd(containerId).withForce(true).exec();
            log.info("Sandbox container {} removed", containerId);
        } catch (NotFoundException e) {
            log.debug("Container {} already removed", containerId);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void ensureImage(String image) throws InterruptedException {
        try {
            docker.inspectImageCmd(image).exec();
            return;
        } catch (NotFoundException e) {
            log.info("Image {} not present locally, pulling", image);
        }
        PullImageResultCallback pull = docker.pullImageCmd(image).exec(new PullImageResultCallback());
        try {
            if (!pull.awaitCompletion(pullTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new ExecutorException("Pulling image " + image + " exceeded " + pullTimeout.toSeconds() + " s");
            }
        } finally {
            closeQuietly(pull);
        }
    }

    private void removeAfterFailedStart(String containerId) {
        try {
            docker.removeContainerCmd(containerId).withForce(true).exec();
            log.info("Removed container {} after failed start", containerId);
        } catch (DockerException e) {
            log.warn("Could not remove container {} after failed start: {}", containerId, e.getMessage());
        }
    }

    private static String decode(ByteArrayOutputStream bytes) {
        return bytes.toString(StandardCharsets.UTF_8);
    }

    private void closeQuietly(ResultCallback<?> callback) {
        try {
            callback.close();
        } catch (IOException e) {
            log.debug("Error closing Docker stream: {}", e.getMessage());
        }
    }
}
