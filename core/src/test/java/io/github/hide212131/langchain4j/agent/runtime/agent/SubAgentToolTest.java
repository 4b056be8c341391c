package io.github.hide212131.langchain4j.agent.runtime.agent;

import static io.github.hide212131.langchain4j.agent.runtime.agent.ScriptedModelClient.call;
import static io.github.hide212131.langchain4j.agent.runtime.agent.ScriptedModelClient.calls;
import static io.github.hide212131.langchain4j.agent.runtime.agent.ScriptedModelClient.finish;
import static io.github.hide212131.langchain4j.agent.runtime.agent.TestTools.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.langchain4j.agent.runtime.CancellationToken;
import io.github.hide212131.langchain4j.agent.runtime.RunCancelledException;
import io.github.hide212131.langchain4j.agent.runtime.event.AgentEventCollector;
import io.github.hide212131.langchain4j.agent.runtime.event.AgentEventType;
import io.github.hide212131.langchain4j.agent.runtime.execution.LocalCodeExecToolProvider;
import io.github.hide212131.langchain4j.agent.runtime.message.AssistantMessage;
import io.github.hide212131.langchain4j.agent.runtime.message.ToolMessage;
import io.github.hide212131.langchain4j.agent.runtime.metadata.ToolUseCountMetadata;
import io.github.hide212131.langchain4j.agent.runtime.session.SessionConfig;
import io.github.hide212131.langchain4j.agent.runtime.session.SessionState;
import io.github.hide212131.langchain4j.agent.runtime.tool.FinishParams;
import io.github.hide212131.langchain4j.agent.runtime.tool.Tool;
import io.github.hide212131.langchain4j.agent.runtime.tool.ToolResult;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SubAgentToolTest {

    private static final SessionConfig NO_OUTPUT = SessionConfig.builder().outputDir(null).build();

    @Test
    void subAgentShouldRunOneLevelDeeperAndReturnReason() {
        List<Integer> depths = new ArrayList<>();
        ScriptedModelClient childClient = new ScriptedModelClient()
                .then(calls(call("probe", text("x"), "k1")))
                .then(calls(finish("child done", "k2")));
        Agent<FinishParams> child = Agent.builder(childClient, "helper")
                .tool(TestTools.tool("probe", (params, context) -> {
                    depths.add(context.depth());
                    return ToolResult.of("probed", ToolUseCountMetadata.once());
                }))
                .buildAgent();
        AgentEventCollector childEvents = new AgentEventCollector();
        child.events().subscribe(AgentEventType.RUN_START, childEvents);

        ScriptedModelClient parentClient = new ScriptedModelClient()
                .then(calls(call("helper", "{\"task\":\"investigate\"}", "p1")))
                .then(calls(finish("parent done", "p2")));
        Agent<FinishParams> parent = Agent.builder(parentClient, "lead").tool(child.toTool()).buildAgent();

        RunResult<FinishParams> result = run(parent);

        assertThat(depths).containsExactly(1);
        assertThat(childEvents.events()).singleElement()
                .satisfies(event -> assertThat(event.metadata().depth()).isEqualTo(1));
        ToolMessage delegated = (ToolMessage) result.lastMessages().get(3);
        assertThat(delegated.content().asText())
                .isEqualTo("<sub_agent_result>\n  <reason>child done</reason>\n</sub_agent_result>");
        SubAgentMetadata metadata = (SubAgentMetadata) result.runMetadata().get("helper");
        assertThat(metadata.messageHistory()).hasSize(1);
        assertThat(metadata.runMetadata()).containsEntry("probe", new ToolUseCountMetadata(1));
        assertThat(childClient.requests().get(0).get(1).content().asText()).isEqualTo("investigate");
    }

    @Test
    void nestedSubAgentsShouldIncrementDepthAtEachLevel() {
        List<Integer> depths = new ArrayList<>();
        Agent<FinishParams> leaf = Agent.builder(new ScriptedModelClient()
                        .then(calls(call("probe", text("x"), "l1")))
                        .then(calls(finish("leaf", "l2"))), "leaf")
                .tool(TestTools.tool("probe", (params, context) -> {
                    depths.add(context.depth());
                    return ToolResult.of("ok");
                }))
                .buildAgent();
        Agent<FinishParams> middle = Agent.builder(new ScriptedModelClient()
                        .then(calls(call("leaf", "{\"task\":\"go deeper\"}", "m1")))
                        .then(calls(finish("middle", "m2"))), "middle")
                .tool(leaf.toTool())
                .buildAgent();
        Agent<FinishParams> root = Agent.builder(new ScriptedModelClient()
                        .then(calls(call("middle", "{\"task\":\"delegate\"}", "r1")))
                        .then(calls(finish("root", "r2"))), "root")
                .tool(middle.toTool())
                .buildAgent();

        run(root);

        assertThat(depths).containsExactly(2);
    }

    @Test
    void failingSubAgentShouldReturnErrorContentWithEmptyMetadata() {
        ScriptedModelClient childClient = new ScriptedModelClient()
                .thenThrow(new IllegalStateException("model unavailable"));
        Agent<FinishParams> child = Agent.builder(childClient, "helper").buildAgent();
        ScriptedModelClient parentClient = new ScriptedModelClient()
                .then(calls(call("helper", "{\"task\":\"try\"}", "p1")))
                .then(calls(finish("parent done", "p2")));
        Agent<FinishParams> parent = Agent.builder(parentClient, "lead").tool(child.toTool()).buildAgent();

        RunResult<FinishParams> result = run(parent);

        ToolMessage delegated = (ToolMessage) result.lastMessages().get(3);
        assertThat(delegated.content().asText()).isEqualTo("<sub_agent_error>model unavailable</sub_agent_error>");
        assertThat(delegated.argsWasValid()).isTrue();
        assertThat(result.runMetadata().get("helper")).isEqualTo(SubAgentMetadata.empty());
    }

    @Test
    void subAgentWithoutFinishShouldReturnEmptyResult() {
        ScriptedModelClient childClient = new ScriptedModelClient().otherwise(AssistantMessage.from("hmm"));
        Agent<FinishParams> child = Agent.builder(childClient, "helper").maxTurns(1).buildAgent();
        ScriptedModelClient parentClient = new ScriptedModelClient()
                .then(calls(call("helper", "{\"task\":\"try\"}", "p1")))
                .then(calls(finish("parent done", "p2")));
        Agent<FinishParams> parent = Agent.builder(parentClient, "lead").tool(child.toTool()).buildAgent();

        RunResult<FinishParams> result = run(parent);

        assertThat(result.lastMessages().get(3).content().asText())
                .isEqualTo("<sub_agent_result>\n</sub_agent_result>");
    }

    @Test
    void cancellationInsideSubAgentShouldPropagateToCaller() {
        CancellationToken token = CancellationToken.create();
        ScriptedModelClient childClient = new ScriptedModelClient()
                .then(calls(call("stop", text("x"), "k1")))
                .otherwise(calls(finish("never", "k2")));
        Agent<FinishParams> child = Agent.builder(childClient, "helper")
                .tool(TestTools.tool("stop", (params, context) -> {
                    token.cancel();
                    return ToolResult.of("stopped");
                }))
                .buildAgent();
        ScriptedModelClient parentClient = new ScriptedModelClient()
                .then(calls(call("helper", "{\"task\":\"work\"}", "p1")))
                .otherwise(calls(finish("never", "p2")));
        Agent<FinishParams> parent = Agent.builder(parentClient, "lead").tool(child.toTool()).buildAgent();

        try (AgentSession<FinishParams> session = parent.session(NO_OUTPUT)) {
            assertThatThrownBy(() -> session.run("task", RunOptions.withCancellation(token)))
                    .isInstanceOf(RunCancelledException.class);
        }
        assertThat(parentClient.requests()).hasSize(1);
    }

    @Test
    void filesShouldMoveBetweenParentAndChildEnvironments(@TempDir Path outputDir) {
        Tool<TestTools.TextParams, ToolUseCountMetadata> upper = TestTools.tool("upper", (params, context) -> {
            String input = new String(context.execEnv().orElseThrow().readFileBytes(params.text()),
                    StandardCharsets.UTF_8);
            context.execEnv().orElseThrow().writeFileBytes("result.txt",
                    input.toUpperCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
            return ToolResult.of("written");
        });
        ScriptedModelClient childClient = new ScriptedModelClient()
                .then(calls(call("upper", text("input.txt"), "k1")))
                .then(calls(call("finish", "{\"reason\":\"converted\",\"paths\":[\"result.txt\"]}", "k2")));
        Agent<FinishParams> child = Agent.builder(childClient, "converter")
                .tool(new LocalCodeExecToolProvider())
                .tool(upper)
                .buildAgent();

        Tool<TestTools.TextParams, ToolUseCountMetadata> seed = TestTools.tool("seed", (params, context) -> {
            context.execEnv().orElseThrow().writeFileBytes("input.txt", params.text().getBytes(StandardCharsets.UTF_8));
            return ToolResult.of("seeded");
        });
        ScriptedModelClient parentClient = new ScriptedModelClient()
                .then(calls(call("seed", text("hello"), "p1")))
                .then(calls(call("converter", "{\"task\":\"convert\",\"inputFiles\":[\"input.txt\"]}", "p2")))
                .then(calls(call("finish", "{\"reason\":\"done\",\"paths\":\"result.txt\"}", "p3")));
        Agent<FinishParams> parent = Agent.builder(parentClient, "lead")
                .tool(new LocalCodeExecToolProvider())
                .tool(seed)
                .tool(child.toTool("Converts files"))
                .buildAgent();

        try (AgentSession<FinishParams> session = parent.session(SessionConfig.builder().outputDir(outputDir).build())) {
            RunResult<FinishParams> result = session.run("convert hello");
            assertThat(result.finishParams().paths()).containsExactly("result.txt");
        }

        assertThat(outputDir.resolve("result.txt")).hasContent("HELLO");
    }

    @Test
    void reusedSessionShouldServeConsecutiveCallsUntilCallerCloses() {
        List<SessionState> sessions = new ArrayList<>();
        ScriptedModelClient childClient = new ScriptedModelClient()
                .then(calls(call("probe", text("1"), "k1")))
                .then(calls(finish("first", "k2")))
                .then(calls(call("probe", text("2"), "k3")))
                .then(calls(finish("second", "k4")));
        Agent<FinishParams> child = Agent.builder(childClient, "helper")
                .tool(TestTools.tool("probe", (params, context) -> {
                    sessions.add(context.session());
                    return ToolResult.of("ok");
                }))
                .buildAgent();
        ScriptedModelClient parentClient = new ScriptedModelClient()
                .then(calls(call("helper", "{\"task\":\"one\"}", "p1")))
                .then(calls(call("helper", "{\"task\":\"two\"}", "p2")))
                .then(calls(finish("done", "p3")));
        Agent<FinishParams> parent = Agent.builder(parentClient, "lead")
                .tool(SubAgentTool.builder(child).reuseSession(true).build())
                .buildAgent();

        RunResult<FinishParams> result = run(parent);

        assertThat(sessions).hasSize(2);
        assertThat(sessions.get(0)).isSameAs(sessions.get(1));
        assertThat(sessions.get(0).disposalStack().isDisposed()).isTrue();
        SubAgentMetadata metadata = (SubAgentMetadata) result.runMetadata().get("helper");
        assertThat(metadata.messageHistory()).hasSize(2);
    }

    @Test
    void customSystemPromptShouldApplyOnlyToDelegatedAgent() {
        ScriptedModelClient childClient = new ScriptedModelClient().then(calls(finish("ok", "k1")));
        Agent<FinishParams> child = Agent.builder(childClient, "helper").systemPrompt("Original.").buildAgent();
        Tool<SubAgentParams, SubAgentMetadata> tool = child.toTool("Helps", "Delegated prompt.");
        ScriptedModelClient parentClient = new ScriptedModelClient()
                .then(calls(call("helper", "{\"task\":\"t\"}", "p1")))
                .then(calls(finish("done", "p2")));
        Agent<FinishParams> parent = Agent.builder(parentClient, "lead").tool(tool).buildAgent();

        run(parent);

        assertThat(tool.name()).isEqualTo("helper");
        assertThat(tool.description()).isEqualTo("Helps");
        assertThat(childClient.requests().get(0).get(0).content().asText()).endsWith("Delegated prompt.");
        assertThat(child.config().systemPrompt()).isEqualTo("Original.");
    }

    @Test
    void metadataShouldConcatenateHistoriesAndMergeRunMetadata() {
        SubAgentMetadata first = new SubAgentMetadata(List.of(List.of()),
                java.util.Map.of("probe", new ToolUseCountMetadata(1), "notes", List.of("a")));
        SubAgentMetadata second = new SubAgentMetadata(List.of(List.of(), List.of()),
                java.util.Map.of("probe", new ToolUseCountMetadata(2), "notes", List.of("b")));

        SubAgentMetadata merged = first.add(second);

        assertThat(merged.messageHistory()).hasSize(3);
        assertThat(merged.runMetadata())
                .containsEntry("probe", new ToolUseCountMetadata(3))
                .containsEntry("notes", List.of("a", "b"));
    }

    private static RunResult<FinishParams> run(Agent<FinishParams> agent) {
        try (AgentSession<FinishParams> session = agent.session(NO_OUTPUT)) {
            return session.run("task");
        }
    }
}
