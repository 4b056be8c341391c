package io.github.hide212131.langchain4j.agent.runtime.execution;

import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import io.github.hide212131.langchain4j.agent.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.agent.runtime.metadata.ToolUseCountMetadata;
import io.github.hide212131.langchain4j.agent.runtime.tool.Tool;
import io.github.hide212131.langchain4j.agent.runtime.tool.ToolResult;
import jakarta.validation.constraints.NotNull;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Base class for code execution environments. Exposes the {@code code_exec} tool and implements file transfer on
 * top of the {@link #readFileBytes} and {@link #writeFileBytes} primitives.
 *
 * <p>An instance serves one open session at a time.</p>
 */
public abstract class AbstractCodeExecToolProvider implements CodeExecutionEnvironment {

    public static final String TOOL_NAME = "code_exec";
    static final int MAX_OUTPUT_LENGTH = 10_000;

    private static final String DEFAULT_DESCRIPTION =
            "Execute shell commands in a sandboxed environment. Returns stdout, stderr, and exit code.";
    private static final JsonObjectSchema PARAMETERS = JsonObjectSchema.builder()
            .addStringProperty("cmd", "Shell command to execute")
            .required("cmd")
            .build();

    private final WorkflowLogger logger = new WorkflowLogger(getClass());
    private final CommandPolicy policy;
    private final String description;
    private final Duration commandTimeout;
    private boolean open;

    protected AbstractCodeExecToolProvider(CommandPolicy policy, String description, Duration commandTimeout) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.description = description != null ? description : DEFAULT_DESCRIPTION;
        this.commandTimeout = Objects.requireNonNull(commandTimeout, "commandTimeout");
    }

    /** Parameters of {@code code_exec}. */
    public record CodeExecParams(@NotNull String cmd) {
    }

    @Override
    public final synchronized void initialize() throws Exception {
        if (open) {
            throw new IllegalStateException(getClass().getSimpleName() + " is already in use by an open session");
        }
        start();
        open = true;
    }

    @Override
    public final synchronized void close() throws Exception {
        if (!open) {
            return;
        }
        open = false;
        stop();
    }

    protected final synchronized boolean isOpen() {
        return open;
    }

    /** Acquires the environment's resources. */
    protected abstract void start() throws Exception;

    /** Releases everything acquired by {@link #start()}. */
    protected abstract void stop() throws Exception;

    @Override
    public List<Tool<?, ?>> getTools() {
        return List.of(codeExecTool());
    }

    @Override
    public CommandResult runCommand(String command) {
        return runCommand(command, commandTimeout);
    }

    protected Tool<CodeExecParams, ToolUseCountMetadata> codeExecTool() {
        return Tool.<CodeExecParams, ToolUseCountMetadata>builder()
                .name(TOOL_NAME)
                .description(description)
                .parameters(CodeExecParams.class, PARAMETERS)
                .handler((params, context) -> ToolResult.of(execute(params.cmd()), ToolUseCountMetadata.once()))
                .build();
    }

    String execute(String cmd) {
        if (!policy.permits(cmd)) {
            return formatResult(CommandResult.failure("Command not allowed by security policy", "security",
                    "Only specific commands are permitted. Check the allowed command patterns."));
        }
        try {
            return formatResult(runCommand(cmd));
        } catch (RuntimeException ex) {
            logger.warn("Command failed in {}: {}", getClass().getSimpleName(), ex.getMessage());
            return formatResult(CommandResult.failure(String.valueOf(ex.getMessage()), "execution_error", null));
        }
    }

    @Override
    public UploadResult uploadFiles(List<Path> localPaths, Path baseDirectory, String destDir) {
        List<String> uploaded = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        Path base = baseDirectory.toAbsolutePath().normalize();
        for (Path localPath : localPaths) {
            Path source = base.resolve(localPath).toAbsolutePath().normalize();
            try {
                if (Files.isDirectory(source)) {
                    String prefix = destDir != null ? destDir : source.getFileName().toString();
                    for (Path file : walk(source)) {
                        String dest = safeDestPath(prefix + "/" + toPosix(source.relativize(file).toString()));
                        writeFileBytes(dest, Files.readAllBytes(file));
                        uploaded.add(dest);
                    }
                } else if (Files.isRegularFile(source)) {
                    String relative = source.startsWith(base) && !source.equals(base)
                            ? toPosix(base.relativize(source).toString())
                            : source.getFileName().toString();
                    String dest = safeDestPath(destDir != null ? destDir + "/" + relative : relative);
                    writeFileBytes(dest, Files.readAllBytes(source));
                    uploaded.add(dest);
                } else {
                    failed.put(localPath.toString(), "Not a file or directory");
                }
            } catch (IOException | RuntimeException ex) {
                failed.put(localPath.toString(), String.valueOf(ex.getMessage()));
            }
        }
        warnFailures("upload", failed);
        return new UploadResult(uploaded, failed);
    }

    @Override
    public UploadResult uploadFrom(List<String> paths, CodeExecutionEnvironment source) {
        Objects.requireNonNull(source, "source");
        List<String> uploaded = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (String path : paths) {
            try {
                String dest = safeDestPath(path);
                writeFileBytes(dest, source.readFileBytes(path));
                uploaded.add(dest);
            } catch (RuntimeException ex) {
                failed.put(path, String.valueOf(ex.getMessage()));
            }
        }
        warnFailures("upload", failed);
        return new UploadResult(uploaded, failed);
    }

    /** Copies each file to {@code outputDir/<file name>}. Subclasses backed by the host file system move instead. */
    @Override
    public SaveOutputFilesResult saveOutputFiles(List<String> paths, Path outputDir) {
        List<SavedFile> saved = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (String path : paths) {
            try {
                byte[] content = readFileBytes(path);
                Path dest = outputDir.resolve(fileName(path));
                Files.createDirectories(outputDir);
                Files.write(dest, content);
                saved.add(new SavedFile(path, dest.toString(), content.length));
            } catch (IOException | RuntimeException ex) {
                failed.put(path, String.valueOf(ex.getMessage()));
            }
        }
        return new SaveOutputFilesResult(saved, failed);
    }

    @Override
    public SaveOutputFilesResult transferOutputFiles(List<String> paths, String destDir,
            CodeExecutionEnvironment dest) {
        Objects.requireNonNull(dest, "dest");
        List<SavedFile> saved = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (String path : paths) {
            try {
                byte[] content = readFileBytes(path);
                String target = destDir == null || destDir.isEmpty() ? fileName(path) : destDir + "/" + fileName(path);
                dest.writeFileBytes(target, content);
                saved.add(new SavedFile(path, target, content.length));
            } catch (RuntimeException ex) {
                failed.put(path, String.valueOf(ex.getMessage()));
            }
        }
        return new SaveOutputFilesResult(saved, failed);
    }

    static String formatResult(CommandResult result) {
        StringBuilder output = new StringBuilder("<command_result>\n");
        output.append("  <exit_code>").append(result.exitCode()).append("</exit_code>\n");
        if (!result.stdout().isEmpty()) {
            output.append("  <stdout>").append(truncate(result.stdout())).append("</stdout>\n");
        }
        if (!result.stderr().isEmpty()) {
            output.append("  <stderr>").append(truncate(result.stderr())).append("</stderr>\n");
        }
        if (result.errorKind() != null) {
            output.append("  <error_kind>").append(result.errorKind()).append("</error_kind>\n");
        }
        if (result.advice() != null) {
            output.append("  <advice>").append(result.advice()).append("</advice>\n");
        }
        return output.append("</command_result>").toString();
    }

    static String truncate(String content) {
        if (content.length() <= MAX_OUTPUT_LENGTH) {
            return content;
        }
        return content.substring(0, MAX_OUTPUT_LENGTH) + "\n\n[Output truncated]";
    }

    static String safeDestPath(String dest) {
        String normalized = toPosix(dest);
        if (normalized.startsWith("/")) {
            throw new IllegalArgumentException("Invalid destination path (must be relative): " + dest);
        }
        for (String segment : normalized.split("/")) {
            if (segment.equals("..")) {
                throw new IllegalArgumentException("Invalid destination path (must not contain '..'): " + dest);
            }
        }
        return normalized;
    }

    static String fileName(String path) {
        String normalized = toPosix(path);
        int idx = normalized.lastIndexOf('/');
        return idx >= 0 ? normalized.substring(idx + 1) : normalized;
    }

    private static String toPosix(String path) {
        return path.replace('\\', '/').replaceFirst("^(\\./)+", "");
    }

    private static List<Path> walk(Path directory) throws IOException {
        try (Stream<Path> files = Files.walk(directory)) {
            return files.filter(Files::isRegularFile).sorted().toList();
        }
    }

    private void warnFailures(String operation, Map<String, String> failed) {
        failed.forEach((path, reason) -> logger.warn("Failed to {} {}: {}", operation, path, reason));
    }
}
