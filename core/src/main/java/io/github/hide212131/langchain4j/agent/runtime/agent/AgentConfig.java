package io.github.hide212131.langchain4j.agent.runtime.agent;

import io.github.hide212131.langchain4j.agent.infra.config.RuntimeConfig;
import io.github.hide212131.langchain4j.agent.infra.observability.WorkflowTracer;
import io.github.hide212131.langchain4j.agent.runtime.AgentConfigurationException;
import io.github.hide212131.langchain4j.agent.runtime.model.ModelClient;
import io.github.hide212131.langchain4j.agent.runtime.tool.FinishParams;
import io.github.hide212131.langchain4j.agent.runtime.tool.FinishTool;
import io.github.hide212131.langchain4j.agent.runtime.tool.Tool;
import io.github.hide212131.langchain4j.agent.runtime.tool.ToolSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable agent definition.
 *
 * @param <FP> parameter type of the finish tool
 */
public final class AgentConfig<FP> {

    public static final int DEFAULT_MAX_TURNS = RuntimeConfig.DEFAULT_MAX_TURNS;
    public static final double DEFAULT_SUMMARIZATION_CUTOFF = RuntimeConfig.DEFAULT_SUMMARIZATION_CUTOFF;

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{1,128}$");

    private final ModelClient client;
    private final String name;
    private final int maxTurns;
    private final String systemPrompt;
    private final List<ToolSource> tools;
    private final Tool<FP, ?> finishTool;
    private final double contextSummarizationCutoff;
    private final WorkflowTracer tracer;

    private AgentConfig(Builder<FP> builder) {
        if (builder.client == null) {
            throw new AgentConfigurationException("Model client is required");
        }
        if (builder.name == null || !NAME_PATTERN.matcher(builder.name).matches()) {
            throw new AgentConfigurationException("Agent name must match " + NAME_PATTERN.pattern() + ": "
                    + builder.name);
        }
        if (builder.maxTurns <= 0) {
            throw new AgentConfigurationException("maxTurns must be greater than zero");
        }
        if (!(builder.cutoff > 0.0 && builder.cutoff <= 1.0)) {
            throw new AgentConfigurationException("Context summarization cutoff must be in (0, 1]: "
                    + builder.cutoff);
        }
        if (builder.finishTool != null && !FinishTool.NAME.equals(builder.finishTool.name())) {
            throw new AgentConfigurationException("Finish tool must be named '" + FinishTool.NAME + "'");
        }
        this.client = builder.client;
        this.name = builder.name;
        this.maxTurns = builder.maxTurns;
        this.systemPrompt = builder.systemPrompt;
        this.tools = List.copyOf(builder.tools);
        this.finishTool = builder.finishTool;
        this.contextSummarizationCutoff = builder.cutoff;
        this.tracer = builder.tracer;
    }

    /** Starts a definition that uses {@link FinishTool#simple()}. */
    public static Builder<FinishParams> builder(ModelClient client, String name) {
        Builder<FinishParams> builder = new Builder<>();
        builder.client = client;
        builder.name = name;
        builder.finishTool = FinishTool.simple();
        return builder;
    }

    public ModelClient client() {
        return client;
    }

    public String name() {
        return name;
    }

    public int maxTurns() {
        return maxTurns;
    }

    /** Agent-specific instructions appended to the system prompt, or null. */
    public String systemPrompt() {
        return systemPrompt;
    }

    public List<ToolSource> tools() {
        return tools;
    }

    /** Null when the agent has no finish tool and always runs until {@link #maxTurns()}. */
    public Tool<FP, ?> finishTool() {
        return finishTool;
    }

    public double contextSummarizationCutoff() {
        return contextSummarizationCutoff;
    }

    public WorkflowTracer tracer() {
        return tracer;
    }

    public Builder<FP> toBuilder() {
        Builder<FP> builder = new Builder<>();
        builder.client = client;
        builder.name = name;
        builder.maxTurns = maxTurns;
        builder.systemPrompt = systemPrompt;
        builder.tools.addAll(tools);
        builder.finishTool = finishTool;
        builder.cutoff = contextSummarizationCutoff;
        builder.tracer = tracer;
        return builder;
    }

    public static final class Builder<FP> {
        private ModelClient client;
        private String name;
        private int maxTurns = DEFAULT_MAX_TURNS;
        private String systemPrompt;
        private final List<ToolSource> tools = new ArrayList<>();
        private Tool<FP, ?> finishTool;
        private double cutoff = DEFAULT_SUMMARIZATION_CUTOFF;
        private WorkflowTracer tracer = WorkflowTracer.disabled();

        private Builder() {
        }

        public Builder<FP> client(ModelClient client) {
            this.client = client;
            return this;
        }

        public Builder<FP> name(String name) {
            this.name = name;
            return this;
        }

        public Builder<FP> maxTurns(int maxTurns) {
            this.maxTurns = maxTurns;
            return this;
        }

        public Builder<FP> systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        public Builder<FP> tool(ToolSource tool) {
            this.tools.add(Objects.requireNonNull(tool, "tool"));
            return this;
        }

        public Builder<FP> tools(List<? extends ToolSource> tools) {
            Objects.requireNonNull(tools, "tools").forEach(this::tool);
            return this;
        }

        public Builder<FP> contextSummarizationCutoff(double cutoff) {
            this.cutoff = cutoff;
            return this;
        }

        public Builder<FP> tracer(WorkflowTracer tracer) {
            this.tracer = Objects.requireNonNull(tracer, "tracer");
            return this;
        }

        /** Applies the turn budget and summarization cutoff from environment configuration. */
        public Builder<FP> runtimeConfig(RuntimeConfig config) {
            this.maxTurns = config.maxTurns();
            this.cutoff = config.summarizationCutoff();
            return this;
        }

        /** Replaces the finish tool, changing the finish parameter type. */
        public <T> Builder<T> finishTool(Tool<T, ?> finishTool) {
            Builder<T> next = copyWithoutFinishTool();
            next.finishTool = Objects.requireNonNull(finishTool, "finishTool");
            return next;
        }

        /** Removes the finish tool; runs then always end at the turn budget. */
        public Builder<Void> withoutFinishTool() {
            return copyWithoutFinishTool();
        }

        public AgentConfig<FP> build() {
            return new AgentConfig<>(this);
        }

        public Agent<FP> buildAgent() {
            return new Agent<>(build());
        }

        private <T> Builder<T> copyWithoutFinishTool() {
            Builder<T> next = new Builder<>();
            next.client = client;
            next.name = name;
            next.maxTurns = maxTurns;
            next.systemPrompt = systemPrompt;
            next.tools.addAll(tools);
            next.cutoff = cutoff;
            next.tracer = tracer;
            return next;
        }
    }
}
