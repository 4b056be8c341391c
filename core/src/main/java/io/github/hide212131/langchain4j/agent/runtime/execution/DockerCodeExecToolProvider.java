package io.github.hide212131.langchain4j.agent.runtime.execution;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Runs commands in a Docker container started from {@code image}. A host temporary directory is mounted at
 * {@code /workspace}, so file transfer goes through the host file system.
 */
public class DockerCodeExecToolProvider extends AbstractCodeExecToolProvider {

    static final String CONTAINER_PATH = "/workspace";
    private static final String DOCKER_COMMAND = "docker";
    private static final Duration DOCKER_TIMEOUT = Duration.ofMinutes(2);

    private final String image;
    private Workspace workspace;
    private String containerId;

    public DockerCodeExecToolProvider(String image) {
        this(image, CommandPolicy.allowAll(), null, DEFAULT_COMMAND_TIMEOUT);
    }

    public DockerCodeExecToolProvider(String image, CommandPolicy policy, String description,
            Duration commandTimeout) {
        super(policy, description, commandTimeout);
        this.image = Objects.requireNonNull(image, "image");
    }

    @Override
    protected void start() {
        CommandResult version = ProcessRunner.run(List.of(DOCKER_COMMAND, "version", "--format", "{{.Server.Version}}"),
                null, DOCKER_TIMEOUT);
        if (version.exitCode() != 0) {
            throw new IllegalStateException("Docker is not available: " + version.stderr().trim());
        }
        Workspace created = Workspace.createTemporary("docker-exec-env-");
        CommandResult run = ProcessRunner.run(List.of(DOCKER_COMMAND, "run", "-d", "--rm", "-v",
                created.root() + ":" + CONTAINER_PATH, "-w", CONTAINER_PATH, image, "sleep", "infinity"), null,
                DOCKER_TIMEOUT);
        if (run.exitCode() != 0 || run.stdout().isBlank()) {
            IllegalStateException failure =
                    new IllegalStateException("Failed to start Docker container from " + image + ": "
                            + run.stderr().trim());
            try {
                created.delete();
            } catch (IllegalStateException ex) {
                failure.addSuppressed(ex);
            }
            throw failure;
        }
        workspace = created;
        containerId = run.stdout().trim();
    }

    @Override
    protected void stop() {
        IllegalStateException failure = null;
        try {
            stopContainer();
        } catch (IllegalStateException ex) {
            failure = ex;
        }
        try {
            if (workspace != null) {
                workspace.delete();
            }
        } catch (IllegalStateException ex) {
            if (failure == null) {
                failure = ex;
            } else {
                failure.addSuppressed(ex);
            }
        }
        workspace = null;
        containerId = null;
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public CommandResult runCommand(String command, Duration timeout) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command must not be blank");
        }
        requireStarted();
        return ProcessRunner.run(
                List.of(DOCKER_COMMAND, "exec", "-w", CONTAINER_PATH, containerId, "sh", "-lc", command), null,
                timeout);
    }

    @Override
    public byte[] readFileBytes(String path) {
        requireStarted();
        return workspace.read(toHostRelative(path));
    }

    @Override
    public void writeFileBytes(String path, byte[] content) {
        requireStarted();
        workspace.write(toHostRelative(path), content);
    }

    static String toHostRelative(String path) {
        String normalized = path.replace('\\', '/');
        if (normalized.equals(CONTAINER_PATH)) {
            return ".";
        }
        if (normalized.startsWith(CONTAINER_PATH + "/")) {
            return normalized.substring(CONTAINER_PATH.length() + 1);
        }
        if (normalized.startsWith("/")) {
            throw new IllegalArgumentException("Path is outside " + CONTAINER_PATH + ": " + path);
        }
        return normalized;
    }

    private void stopContainer() {
        if (containerId == null) {
            return;
        }
        CommandResult result = ProcessRunner.run(List.of(DOCKER_COMMAND, "stop", containerId), null, DOCKER_TIMEOUT);
        if (result.exitCode() != 0) {
            throw new IllegalStateException("Failed to stop Docker container " + containerId);
        }
    }

    private void requireStarted() {
        if (containerId == null || workspace == null) {
            throw new IllegalStateException("Execution environment is not initialized");
        }
    }
}
