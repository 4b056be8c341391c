package io.github.hide212131.langchain4j.agent.runtime.session;

import io.github.hide212131.langchain4j.agent.runtime.AgentConfigurationException;
import io.github.hide212131.langchain4j.agent.runtime.execution.CodeExecutionEnvironment;
import io.github.hide212131.langchain4j.agent.runtime.skill.SkillMetadata;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable state of one agent session. Created when the session opens, shared by every run of that session and
 * torn down exactly once through its {@link DisposalStack}.
 */
public final class SessionState {

    private final DisposalStack disposalStack = new DisposalStack();
    private final int depth;
    private final CodeExecutionEnvironment parentExecEnv;
    private final Path outputDir;
    private final List<String> uploadedFilePaths = new ArrayList<>();
    private final List<SkillMetadata> skillsMetadata = new ArrayList<>();
    private CodeExecutionEnvironment execEnv;

    public SessionState(int depth, CodeExecutionEnvironment parentExecEnv, Path outputDir) {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative");
        }
        this.depth = depth;
        this.parentExecEnv = parentExecEnv;
        this.outputDir = outputDir;
    }

    public DisposalStack disposalStack() {
        return disposalStack;
    }

    public int depth() {
        return depth;
    }

    public boolean isRoot() {
        return depth == 0;
    }

    public Optional<CodeExecutionEnvironment> execEnv() {
        return Optional.ofNullable(execEnv);
    }

    public void attachExecEnv(CodeExecutionEnvironment env) {
        Objects.requireNonNull(env, "env");
        if (execEnv != null) {
            throw new AgentConfigurationException("Agent can only have one code execution environment");
        }
        execEnv = env;
    }

    public Optional<CodeExecutionEnvironment> parentExecEnv() {
        return Optional.ofNullable(parentExecEnv);
    }

    public Optional<Path> outputDir() {
        return Optional.ofNullable(outputDir);
    }

    public List<String> uploadedFilePaths() {
        return Collections.unmodifiableList(uploadedFilePaths);
    }

    public void addUploadedFiles(List<String> paths) {
        uploadedFilePaths.addAll(paths);
    }

    public List<SkillMetadata> skillsMetadata() {
        return Collections.unmodifiableList(skillsMetadata);
    }

    public void setSkillsMetadata(List<SkillMetadata> skills) {
        skillsMetadata.clear();
        skillsMetadata.addAll(skills);
    }
}
