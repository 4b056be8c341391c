package io.github.hide212131.langchain4j.agent.runtime.execution;

import io.github.hide212131.langchain4j.agent.runtime.tool.ToolProvider;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * A tool provider that owns a sandboxed file system and shell. An agent has at most one. Paths inside the
 * environment are relative to its working directory.
 */
public interface CodeExecutionEnvironment extends ToolProvider {

    Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofMinutes(5);

    default CommandResult runCommand(String command) {
        return runCommand(command, DEFAULT_COMMAND_TIMEOUT);
    }

    CommandResult runCommand(String command, Duration timeout);

    byte[] readFileBytes(String path);

    void writeFileBytes(String path, byte[] content);

    /**
     * Copies local files or directories into the environment. Directories are copied recursively below
     * {@code destDir} (or their own name when {@code destDir} is null); files keep their path relative to
     * {@code baseDirectory} when inside it, else their file name.
     */
    UploadResult uploadFiles(List<Path> localPaths, Path baseDirectory, String destDir);

    /** Copies files from {@code source} into this environment under the same relative paths. */
    UploadResult uploadFrom(List<String> paths, CodeExecutionEnvironment source);

    /** Moves files out of the environment into a local directory. */
    SaveOutputFilesResult saveOutputFiles(List<String> paths, Path outputDir);

    /** Copies files into another environment, under {@code destDir} there (empty for its root). */
    SaveOutputFilesResult transferOutputFiles(List<String> paths, String destDir, CodeExecutionEnvironment dest);
}
