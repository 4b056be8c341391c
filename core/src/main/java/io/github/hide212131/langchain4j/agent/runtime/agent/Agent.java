package io.github.hide212131.langchain4j.agent.runtime.agent;

import io.github.hide212131.langchain4j.agent.runtime.event.AgentEventBus;
import io.github.hide212131.langchain4j.agent.runtime.execution.CodeExecutionEnvironment;
import io.github.hide212131.langchain4j.agent.runtime.model.ModelClient;
import io.github.hide212131.langchain4j.agent.runtime.session.SessionConfig;
import io.github.hide212131.langchain4j.agent.runtime.tool.FinishParams;
import io.github.hide212131.langchain4j.agent.runtime.tool.Tool;
import java.util.Objects;

/**
 * An LLM agent: a model, tools and a finish tool. The agent itself holds no run state; every run happens inside
 * an {@link AgentSession}.
 *
 * <pre>{@code
 * Agent<FinishParams> agent = Agent.builder(client, "researcher")
 *         .tool(new LocalCodeExecToolProvider())
 *         .buildAgent();
 * try (AgentSession<FinishParams> session = agent.session()) {
 *     RunResult<FinishParams> result = session.run("Summarize data.csv");
 * }
 * }</pre>
 *
 * @param <FP> parameter type of the finish tool
 */
public final class Agent<FP> {

    private final AgentConfig<FP> config;
    private final AgentEventBus events;

    public Agent(AgentConfig<FP> config) {
        this(config, new AgentEventBus());
    }

    private Agent(AgentConfig<FP> config, AgentEventBus events) {
        this.config = Objects.requireNonNull(config, "config");
        this.events = events;
    }

    public static AgentConfig.Builder<FinishParams> builder(ModelClient client, String name) {
        return AgentConfig.builder(client, name);
    }

    public String name() {
        return config.name();
    }

    public AgentConfig<FP> config() {
        return config;
    }

    /** Events of every session of this agent. */
    public AgentEventBus events() {
        return events;
    }

    public AgentSession<FP> session() {
        return session(SessionConfig.defaults());
    }

    public AgentSession<FP> session(SessionConfig sessionConfig) {
        return new AgentSession<>(this, sessionConfig, 0, null);
    }

    /** Session of this agent running as a sub-agent; its outputs stay in its environment until transferred. */
    AgentSession<FP> childSession(int depth, CodeExecutionEnvironment parentExecEnv) {
        SessionConfig childConfig = SessionConfig.builder().outputDir(null).loggingEnabled(false).build();
        return new AgentSession<>(this, childConfig, depth, parentExecEnv);
    }

    /** Runs one task in a fresh session with default settings and closes it. */
    public RunResult<FP> run(String task) {
        try (AgentSession<FP> session = session()) {
            return session.run(task);
        }
    }

    /** Copy of this agent with a different agent-specific system prompt, publishing to the same event bus. */
    public Agent<FP> withSystemPrompt(String systemPrompt) {
        return new Agent<>(config.toBuilder().systemPrompt(systemPrompt).build(), events);
    }

    public Tool<SubAgentParams, SubAgentMetadata> toTool() {
        return SubAgentTool.builder(this).build();
    }

    public Tool<SubAgentParams, SubAgentMetadata> toTool(String description) {
        return SubAgentTool.builder(this).description(description).build();
    }

    public Tool<SubAgentParams, SubAgentMetadata> toTool(String description, String systemPrompt) {
        return SubAgentTool.builder(this).description(description).systemPrompt(systemPrompt).build();
    }
}
