package io.github.hide212131.langchain4j.agent.runtime.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.langchain4j.agent.runtime.AgentConfigurationException;
import io.github.hide212131.langchain4j.agent.runtime.execution.LocalCodeExecToolProvider;
import io.github.hide212131.langchain4j.agent.runtime.skill.SkillMetadata;
import io.github.hide212131.langchain4j.agent.runtime.tool.FinishTool;
import io.github.hide212131.langchain4j.agent.runtime.tool.Tool;
import io.github.hide212131.langchain4j.agent.runtime.tool.ToolProvider;
import io.github.hide212131.langchain4j.agent.runtime.tool.ToolRegistry;
import io.github.hide212131.langchain4j.agent.runtime.tool.ToolResult;
import io.github.hide212131.langchain4j.agent.runtime.tool.ToolSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SessionLifecycleManagerTest {

    @TempDir
    Path workDir;

    private final List<String> log = new ArrayList<>();
    private final SessionLifecycleManager manager = new SessionLifecycleManager();
    private final ToolRegistry registry = new ToolRegistry();

    @Test
    void openShouldAcquireInOrderAndCloseInReverse() {
        LocalCodeExecToolProvider env = new LocalCodeExecToolProvider();
        SessionState state = new SessionState(0, null, null);
        List<ToolSource> tools = List.of(provider("search"), simpleTool("calc"), env, provider("fetch"));

        manager.open(state, config().build(), tools, FinishTool.simple(), registry);

        assertThat(state.execEnv()).containsSame(env);
        assertThat(List.copyOf(registry.names())).containsExactly("code_exec", "search", "calc", "fetch", "finish");
        assertThat(log).containsExactly("init search", "init fetch");
        assertThat(state.disposalStack().size()).isEqualTo(3);

        manager.close(state, List.of());

        assertThat(log).endsWith("close fetch", "close search");
        assertThat(state.disposalStack().isDisposed()).isTrue();
        assertThatThrownBy(env::workingDirectory).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void secondExecutionEnvironmentShouldBeRejected() {
        SessionState state = new SessionState(0, null, null);
        List<ToolSource> tools = List.of(new LocalCodeExecToolProvider(), new LocalCodeExecToolProvider());

        assertThatThrownBy(() -> manager.open(state, config().build(), tools, null, registry))
                .isInstanceOf(AgentConfigurationException.class)
                .hasMessageContaining("one code execution environment");
    }

    @Test
    void failingProviderShouldDisposeEverythingAcquiredBefore() {
        SessionState state = new SessionState(0, null, null);
        ToolProvider broken = new ToolProvider() {
            @Override
            public void initialize() throws Exception {
                throw new IOException("cannot connect");
            }

            @Override
            public List<Tool<?, ?>> getTools() {
                return List.of();
            }

            @Override
            public void close() {
                log.add("close broken");
            }
        };

        assertThatThrownBy(() -> manager.open(state, config().build(), List.of(provider("search"), broken), null,
                registry))
                .isInstanceOf(AgentConfigurationException.class)
                .hasMessageContaining("cannot connect");
        assertThat(log).containsExactly("init search", "close search");
        assertThat(state.disposalStack().isDisposed()).isTrue();
    }

    @Test
    void inputFilesShouldBeUploadedIntoEnvironment() throws IOException {
        Files.writeString(workDir.resolve("data.csv"), "a,b");
        Files.createDirectories(workDir.resolve("docs"));
        Files.writeString(workDir.resolve("docs/readme.md"), "# docs");
        LocalCodeExecToolProvider env = new LocalCodeExecToolProvider();
        SessionState state = new SessionState(0, null, null);

        manager.open(state, config().inputFile("*.csv").inputFile("docs/readme.md").build(), List.of(env), null,
                registry);
        try {
            assertThat(state.uploadedFilePaths()).containsExactly("data.csv", "docs/readme.md");
            assertThat(new String(env.readFileBytes("docs/readme.md"), StandardCharsets.UTF_8)).isEqualTo("# docs");
        } finally {
            manager.close(state, List.of());
        }
    }

    @Test
    void inputFilesWithoutEnvironmentShouldBeConfigurationError() throws IOException {
        Files.writeString(workDir.resolve("data.csv"), "a,b");
        SessionState state = new SessionState(0, null, null);

        assertThatThrownBy(() -> manager.open(state, config().inputFile("data.csv").build(), List.of(), null,
                registry))
                .isInstanceOf(AgentConfigurationException.class);
    }

    @Test
    void skillsShouldBeUploadedAndDescribed() throws IOException {
        Path skill = Files.createDirectories(workDir.resolve("skills/pdf"));
        Files.writeString(skill.resolve("SKILL.md"), "---\nname: pdf\ndescription: Work with PDF files\n---\n# PDF\n");
        LocalCodeExecToolProvider env = new LocalCodeExecToolProvider();
        SessionState state = new SessionState(0, null, null);

        manager.open(state, config().skillsDir(Path.of("skills")).build(), List.of(env), null, registry);
        try {
            assertThat(state.skillsMetadata()).containsExactly(
                    new SkillMetadata("pdf", "Work with PDF files", "skills/pdf"));
            assertThat(new String(env.readFileBytes("skills/pdf/SKILL.md"), StandardCharsets.UTF_8))
                    .startsWith("---");
        } finally {
            manager.close(state, List.of());
        }
    }

    @Test
    void missingSkillsDirectoryShouldReleaseEnvironment() {
        LocalCodeExecToolProvider env = new LocalCodeExecToolProvider();
        SessionState state = new SessionState(0, null, null);

        assertThatThrownBy(() -> manager.open(state, config().skillsDir(Path.of("nowhere")).build(), List.of(env),
                null, registry))
                .isInstanceOf(AgentConfigurationException.class)
                .hasMessageContaining("nowhere");
        assertThatThrownBy(env::workingDirectory).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void closeShouldMoveFinishPathsIntoOutputDirectory() {
        Path outputDir = workDir.resolve("out");
        LocalCodeExecToolProvider env = new LocalCodeExecToolProvider();
        SessionState state = new SessionState(0, null, outputDir);
        manager.open(state, config().build(), List.of(env), null, registry);
        env.writeFileBytes("report.txt", "done".getBytes(StandardCharsets.UTF_8));

        manager.close(state, List.of("report.txt", "missing.txt"));

        assertThat(outputDir.resolve("report.txt")).hasContent("done");
        assertThat(outputDir.resolve("missing.txt")).doesNotExist();
    }

    @Test
    void closeShouldCopyChildOutputsIntoParentEnvironment() throws Exception {
        LocalCodeExecToolProvider parent = new LocalCodeExecToolProvider();
        parent.initialize();
        try {
            LocalCodeExecToolProvider child = new LocalCodeExecToolProvider();
            SessionState state = new SessionState(1, parent, Path.of("results"));
            manager.open(state, config().build(), List.of(child), null, new ToolRegistry());
            child.writeFileBytes("chart.png", new byte[] {1, 2, 3});

            manager.close(state, List.of("chart.png"));

            assertThat(parent.readFileBytes("results/chart.png")).containsExactly(1, 2, 3);
        } finally {
            parent.close();
        }
    }

    @Test
    void closeShouldReportDisposalFailures() {
        SessionState state = new SessionState(0, null, null);
        manager.open(state, config().build(), List.of(), null, registry);
        state.disposalStack().push("failing", () -> {
            throw new IllegalStateException("leaked");
        });

        assertThatThrownBy(() -> manager.close(state, List.of()))
                .isInstanceOf(DisposalException.class)
                .hasMessageContaining("leaked");
    }

    private SessionConfig.Builder config() {
        return SessionConfig.builder().workingDirectory(workDir).outputDir(null);
    }

    private ToolProvider provider(String name) {
        return new ToolProvider() {
            @Override
            public void initialize() {
                log.add("init " + name);
            }

            @Override
            public List<Tool<?, ?>> getTools() {
                return List.of(simpleTool(name));
            }

            @Override
            public void close() {
                log.add("close " + name);
            }
        };
    }

    private static Tool<Void, Void> simpleTool(String name) {
        return Tool.<Void, Void>builder()
                .name(name)
                .description("Tool " + name)
                .handler((params, context) -> ToolResult.of(name))
                .build();
    }
}
