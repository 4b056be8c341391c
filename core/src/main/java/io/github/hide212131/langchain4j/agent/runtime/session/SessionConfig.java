package io.github.hide212131.langchain4j.agent.runtime.session;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-session options: where finished output files go, which local files and skills are uploaded, and whether
 * the run is logged.
 */
public final class SessionConfig {

    public static final Path DEFAULT_OUTPUT_DIR = Path.of("output");

    private final Path outputDir;
    private final List<String> inputFiles;
    private final Path skillsDir;
    private final Path workingDirectory;
    private final boolean loggingEnabled;

    private SessionConfig(Builder builder) {
        this.outputDir = builder.outputDir;
        this.inputFiles = List.copyOf(builder.inputFiles);
        this.skillsDir = builder.skillsDir;
        this.workingDirectory = builder.workingDirectory != null
                ? builder.workingDirectory.toAbsolutePath().normalize()
                : Path.of("").toAbsolutePath();
        this.loggingEnabled = builder.loggingEnabled;
    }

    public static SessionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Absent for sessions whose outputs are not persisted, e.g. sub-agent sessions. */
    public Optional<Path> outputDir() {
        return Optional.ofNullable(outputDir);
    }

    public List<String> inputFiles() {
        return inputFiles;
    }

    public Optional<Path> skillsDir() {
        return Optional.ofNullable(skillsDir);
    }

    public Path workingDirectory() {
        return workingDirectory;
    }

    public boolean loggingEnabled() {
        return loggingEnabled;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.outputDir = outputDir;
        builder.inputFiles.addAll(inputFiles);
        builder.skillsDir = skillsDir;
        builder.workingDirectory = workingDirectory;
        builder.loggingEnabled = loggingEnabled;
        return builder;
    }

    public static final class Builder {
        private Path outputDir = DEFAULT_OUTPUT_DIR;
        private final List<String> inputFiles = new ArrayList<>();
        private Path skillsDir;
        private Path workingDirectory;
        private boolean loggingEnabled = true;

        private Builder() {
        }

        /** Pass null to keep finished output files inside the execution environment. */
        public Builder outputDir(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder inputFiles(List<String> inputFiles) {
            this.inputFiles.clear();
            Objects.requireNonNull(inputFiles, "inputFiles").forEach(this::inputFile);
            return this;
        }

        /** A path, directory or glob pattern, relative to the working directory unless absolute. */
        public Builder inputFile(String inputFile) {
            this.inputFiles.add(Objects.requireNonNull(inputFile, "inputFile"));
            return this;
        }

        public Builder skillsDir(Path skillsDir) {
            this.skillsDir = skillsDir;
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder loggingEnabled(boolean loggingEnabled) {
            this.loggingEnabled = loggingEnabled;
            return this;
        }

        public SessionConfig build() {
            return new SessionConfig(this);
        }
    }
}
