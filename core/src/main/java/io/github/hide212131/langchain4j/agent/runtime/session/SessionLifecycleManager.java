package io.github.hide212131.langchain4j.agent.runtime.session;

import io.github.hide212131.langchain4j.agent.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.agent.runtime.AgentConfigurationException;
import io.github.hide212131.langchain4j.agent.runtime.execution.CodeExecutionEnvironment;
import io.github.hide212131.langchain4j.agent.runtime.execution.SaveOutputFilesResult;
import io.github.hide212131.langchain4j.agent.runtime.execution.UploadResult;
import io.github.hide212131.langchain4j.agent.runtime.skill.SkillMetadataLoader;
import io.github.hide212131.langchain4j.agent.runtime.tool.Tool;
import io.github.hide212131.langchain4j.agent.runtime.tool.ToolProvider;
import io.github.hide212131.langchain4j.agent.runtime.tool.ToolRegistry;
import io.github.hide212131.langchain4j.agent.runtime.tool.ToolSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Opens and closes agent sessions.
 *
 * <p>Opening acquires resources in a fixed order: the execution environment, input-file uploads, the skills
 * directory, the remaining providers and tools in configured order, and the finish tool last. Every acquired
 * resource is pushed on the session's {@link DisposalStack}. Closing saves the finish paths out of the execution
 * environment and then unwinds the stack.</p>
 */
public final class SessionLifecycleManager {

    private static final WorkflowLogger LOGGER = new WorkflowLogger(SessionLifecycleManager.class);

    private final SkillMetadataLoader skillMetadataLoader;

    public SessionLifecycleManager() {
        this(new SkillMetadataLoader());
    }

    public SessionLifecycleManager(SkillMetadataLoader skillMetadataLoader) {
        this.skillMetadataLoader = Objects.requireNonNull(skillMetadataLoader, "skillMetadataLoader");
    }

    /**
     * Populates {@code registry} and {@code state}. On failure everything acquired so far is disposed before the
     * exception propagates.
     */
    public void open(SessionState state, SessionConfig config, List<ToolSource> tools, Tool<?, ?> finishTool,
            ToolRegistry registry) {
        List<CodeExecutionEnvironment> environments = tools.stream()
                .filter(CodeExecutionEnvironment.class::isInstance)
                .map(CodeExecutionEnvironment.class::cast)
                .toList();
        if (environments.size() > 1) {
            throw new AgentConfigurationException("Agent can only have one code execution environment, found "
                    + environments.size());
        }
        try {
            if (!environments.isEmpty()) {
                CodeExecutionEnvironment env = environments.get(0);
                registry.registerAll(startProvider(state, env));
                state.attachExecEnv(env);
            }
            uploadInputFiles(state, config);
            uploadSkills(state, config);
            for (ToolSource source : tools) {
                if (source instanceof CodeExecutionEnvironment) {
                    continue;
                }
                if (source instanceof Tool<?, ?> tool) {
                    registry.register(tool);
                } else {
                    registry.registerAll(startProvider(state, (ToolProvider) source));
                }
            }
            if (finishTool != null) {
                registry.register(finishTool);
            }
        } catch (RuntimeException ex) {
            try {
                state.disposalStack().dispose();
            } catch (DisposalException disposal) {
                ex.addSuppressed(disposal);
            }
            throw ex;
        }
    }

    /**
     * Saves {@code finishPaths} out of the execution environment, then disposes the session. Root sessions move the
     * files into the output directory; child sessions with an output directory copy them into the parent's
     * environment.
     */
    public void close(SessionState state, List<String> finishPaths) {
        RuntimeException failure = null;
        try {
            saveOutputs(state, finishPaths);
        } catch (RuntimeException ex) {
            failure = ex;
        }
        try {
            state.disposalStack().dispose();
        } catch (DisposalException ex) {
            if (failure == null) {
                failure = ex;
            } else {
                failure.addSuppressed(ex);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private List<Tool<?, ?>> startProvider(SessionState state, ToolProvider provider) {
        String label = provider.getClass().getSimpleName();
        try {
            provider.initialize();
            state.disposalStack().enter(label, provider);
            return provider.getTools();
        } catch (RuntimeException ex) {
            throw ex;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AgentConfigurationException("Interrupted while initializing " + label, ex);
        } catch (Exception ex) {
            throw new AgentConfigurationException("Failed to initialize " + label + ": " + ex.getMessage(), ex);
        }
    }

    private void uploadInputFiles(SessionState state, SessionConfig config) {
        if (config.inputFiles().isEmpty()) {
            return;
        }
        CodeExecutionEnvironment env = state.execEnv().orElseThrow(() -> new AgentConfigurationException(
                "Input files require a code execution environment"));
        List<Path> resolved = new InputFileResolver(config.workingDirectory()).resolve(config.inputFiles());
        UploadResult result = env.uploadFiles(resolved, config.workingDirectory(), null);
        state.addUploadedFiles(result.uploaded());
        LOGGER.info("Uploaded {} input file(s)", result.uploaded().size());
    }

    private void uploadSkills(SessionState state, SessionConfig config) {
        if (config.skillsDir().isEmpty()) {
            return;
        }
        Path skillsDir = config.workingDirectory().resolve(config.skillsDir().get());
        CodeExecutionEnvironment env = state.execEnv().orElseThrow(() -> new AgentConfigurationException(
                "A skills directory requires a code execution environment"));
        if (!Files.isDirectory(skillsDir)) {
            throw new AgentConfigurationException("Skills directory does not exist: " + skillsDir);
        }
        env.uploadFiles(List.of(skillsDir), config.workingDirectory(), SkillMetadataLoader.SKILLS_DEST_DIR);
        state.setSkillsMetadata(skillMetadataLoader.load(skillsDir));
    }

    private void saveOutputs(SessionState state, List<String> finishPaths) {
        if (finishPaths == null || finishPaths.isEmpty() || state.outputDir().isEmpty()
                || state.execEnv().isEmpty()) {
            return;
        }
        CodeExecutionEnvironment env = state.execEnv().get();
        Path outputDir = state.outputDir().get();
        SaveOutputFilesResult result;
        if (state.isRoot()) {
            result = env.saveOutputFiles(finishPaths, outputDir);
        } else if (state.parentExecEnv().isPresent()) {
            result = env.transferOutputFiles(finishPaths, outputDir.toString().replace('\\', '/'),
                    state.parentExecEnv().get());
        } else {
            return;
        }
        result.saved().forEach(saved -> LOGGER.info("Saved {} to {} ({} bytes)", saved.sourcePath(),
                saved.outputPath(), saved.size()));
        result.failed().forEach((path, reason) -> LOGGER.warn("Failed to save {}: {}", path, reason));
    }
}
