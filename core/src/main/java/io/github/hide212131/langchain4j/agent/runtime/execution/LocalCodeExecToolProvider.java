package io.github.hide212131.langchain4j.agent.runtime.execution;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Runs commands with {@code bash -c} inside a temporary directory on the host. */
public class LocalCodeExecToolProvider extends AbstractCodeExecToolProvider {

    private Workspace workspace;

    public LocalCodeExecToolProvider() {
        this(CommandPolicy.allowAll(), null, DEFAULT_COMMAND_TIMEOUT);
    }

    public LocalCodeExecToolProvider(CommandPolicy policy, String description, Duration commandTimeout) {
        super(policy, description, commandTimeout);
    }

    @Override
    protected void start() {
        workspace = Workspace.createTemporary("local-exec-env-");
    }

    @Override
    protected void stop() {
        Workspace current = workspace;
        workspace = null;
        if (current != null) {
            current.delete();
        }
    }

    /** Host directory backing this environment. */
    public Path workingDirectory() {
        return workspace().root();
    }

    @Override
    public CommandResult runCommand(String command, Duration timeout) {
        Objects.requireNonNull(command, "command");
        return ProcessRunner.run(List.of("bash", "-c", command), workspace().root(), timeout);
    }

    @Override
    public byte[] readFileBytes(String path) {
        return workspace().read(path);
    }

    @Override
    public void writeFileBytes(String path, byte[] content) {
        workspace().write(path, content);
    }

    /** Moves each file out of the temporary directory into {@code outputDir}. */
    @Override
    public SaveOutputFilesResult saveOutputFiles(List<String> paths, Path outputDir) {
        List<SavedFile> saved = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        Workspace current = workspace();
        for (String path : paths) {
            Path source;
            try {
                source = current.resolve(path);
            } catch (IllegalArgumentException ex) {
                failed.put(path, ex.getMessage());
                continue;
            }
            if (!Files.isRegularFile(source)) {
                failed.put(path, "File does not exist");
                continue;
            }
            try {
                Files.createDirectories(outputDir);
                Path dest = outputDir.resolve(source.getFileName().toString());
                long size = Files.size(source);
                Files.move(source, dest, StandardCopyOption.REPLACE_EXISTING);
                saved.add(new SavedFile(path, dest.toString(), size));
            } catch (IOException ex) {
                failed.put(path, ex.getMessage());
            }
        }
        return new SaveOutputFilesResult(saved, failed);
    }

    private Workspace workspace() {
        Workspace current = workspace;
        if (current == null) {
            throw new IllegalStateException("Execution environment is not initialized");
        }
        return current;
    }
}
