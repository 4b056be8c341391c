package io.github.hide212131.langchain4j.agent.runtime.agent;

import io.github.hide212131.langchain4j.agent.infra.observability.WorkflowTracer;
import io.github.hide212131.langchain4j.agent.runtime.CancellationToken;
import io.github.hide212131.langchain4j.agent.runtime.event.AgentEventBus;
import io.github.hide212131.langchain4j.agent.runtime.event.AgentEventMetadata;
import io.github.hide212131.langchain4j.agent.runtime.event.AgentEventPayload;
import io.github.hide212131.langchain4j.agent.runtime.event.AgentEventType;
import io.github.hide212131.langchain4j.agent.runtime.message.AssistantMessage;
import io.github.hide212131.langchain4j.agent.runtime.message.ChatMessage;
import io.github.hide212131.langchain4j.agent.runtime.message.SystemMessage;
import io.github.hide212131.langchain4j.agent.runtime.message.TokenUsage;
import io.github.hide212131.langchain4j.agent.runtime.message.ToolCall;
import io.github.hide212131.langchain4j.agent.runtime.metadata.MetadataAggregator;
import io.github.hide212131.langchain4j.agent.runtime.metadata.TokenUsageMetadata;
import io.github.hide212131.langchain4j.agent.runtime.model.ContextOverflowException;
import io.github.hide212131.langchain4j.agent.runtime.model.ModelClient;
import io.github.hide212131.langchain4j.agent.runtime.session.SessionState;
import io.github.hide212131.langchain4j.agent.runtime.tool.Tool;
import io.github.hide212131.langchain4j.agent.runtime.tool.ToolContext;
import io.github.hide212131.langchain4j.agent.runtime.tool.ToolDispatch;
import io.github.hide212131.langchain4j.agent.runtime.tool.ToolDispatcher;
import io.github.hide212131.langchain4j.agent.runtime.tool.ToolRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Drives one run: generate, execute the requested tools in order, and repeat until the finish tool succeeds or the
 * turn budget is spent. Summarizes the conversation when a turn uses more than the configured share of the
 * model's context window.
 */
final class TurnController<FP> {

    private final AgentConfig<FP> config;
    private final ToolRegistry registry;
    private final SessionState state;
    private final AgentEventBus events;
    private final ToolDispatcher dispatcher;
    private final ContextSummarizer summarizer;
    private final WorkflowTracer tracer;

    TurnController(AgentConfig<FP> config, ToolRegistry registry, SessionState state, AgentEventBus events) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.state = Objects.requireNonNull(state, "state");
        this.events = Objects.requireNonNull(events, "events");
        this.tracer = config.tracer();
        this.dispatcher = new ToolDispatcher(registry, tracer);
        this.summarizer = new ContextSummarizer(config.client());
    }

    RunResult<FP> run(List<ChatMessage> initialMessages, String runId, CancellationToken cancellation) {
        ToolContext context = new ToolContext(config.name(), runId, state, cancellation, events);
        AgentEventMetadata metadata = context.eventMetadata();

        List<ChatMessage> current = new ArrayList<>();
        current.add(SystemMessage.from(SystemPromptBuilder.build(registry, state, config.systemPrompt())));
        current.addAll(initialMessages);
        List<List<ChatMessage>> history = new ArrayList<>();
        List<ChatMessage> group = new ArrayList<>(current);

        MetadataAggregator runMetadata = new MetadataAggregator();
        runMetadata.register(MetadataAggregator.TOKEN_USAGE);
        registry.names().forEach(runMetadata::register);

        FP finishParams = null;
        boolean finished = false;
        for (int turn = 0; turn < config.maxTurns(); turn++) {
            cancellation.throwIfCancellationRequested();
            events.publish(AgentEventType.TURN_START, metadata,
                    new AgentEventPayload.TurnStart(turn, config.maxTurns()));

            AssistantMessage assistant;
            try {
                assistant = generate(current, cancellation, turn);
            } catch (ContextOverflowException overflow) {
                if (current.size() < 2) {
                    throw overflow;
                }
                tracer.addEvent("context.overflow", Map.of("agent.turn", turn, "messages.count", current.size()));
                history.add(group);
                current = summarize(current, metadata, cancellation, 1.0, history);
                group = new ArrayList<>(current);
                assistant = generate(current, cancellation, turn);
            }
            TokenUsage usage = assistant.tokenUsage();
            if (usage != null) {
                runMetadata.record(MetadataAggregator.TOKEN_USAGE, TokenUsageMetadata.from(usage));
            }
            current.add(assistant);
            group.add(assistant);
            events.publish(AgentEventType.MESSAGE_ASSISTANT, metadata,
                    new AgentEventPayload.AssistantOutput(assistant.content().asText(), assistant.toolCalls()));

            for (ToolCall call : assistant.toolCalls()) {
                ToolDispatch dispatch = dispatcher.dispatch(call, context, runMetadata);
                current.add(dispatch.message());
                group.add(dispatch.message());
                events.publish(AgentEventType.MESSAGE_TOOL, metadata, new AgentEventPayload.ToolOutput(
                        call.name(), dispatch.message().content().asText(), dispatch.message().argsWasValid()));
                if (!finished && isFinishCall(call, dispatch)) {
                    finished = true;
                    finishParams = castFinishParams(dispatch.params());
                }
            }
            events.publish(AgentEventType.TURN_COMPLETE, metadata, new AgentEventPayload.TurnComplete(turn, usage));

            if (finished) {
                history.add(group);
                group = List.of();
                break;
            }
            if (shouldSummarize(usage)) {
                history.add(group);
                double percentUsed = (usage.input() + usage.output()) / (double) config.client().maxContextTokens();
                current = summarize(current, metadata, cancellation, percentUsed, history);
                group = new ArrayList<>(current);
            }
        }
        if (!group.isEmpty()) {
            history.add(group);
        }
        return new RunResult<>(finishParams, finished, history, runMetadata.aggregate());
    }

    private AssistantMessage generate(List<ChatMessage> messages, CancellationToken cancellation, int turn) {
        cancellation.throwIfCancellationRequested();
        ModelClient client = config.client();
        List<Tool<?, ?>> tools = List.copyOf(registry.tools());
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("agent.name", config.name());
        attributes.put("agent.turn", turn);
        attributes.put("agent.depth", state.depth());
        attributes.put("model.id", client.modelIdentifier());
        attributes.put("messages.count", messages.size());
        return tracer.trace("agent.turn", attributes, () -> client.generate(List.copyOf(messages), tools));
    }

    private boolean shouldSummarize(TokenUsage usage) {
        int window = config.client().maxContextTokens();
        if (usage == null || window <= 0) {
            return false;
        }
        double used = (usage.input() + usage.output()) / (double) window;
        return used >= config.contextSummarizationCutoff();
    }

    private List<ChatMessage> summarize(List<ChatMessage> current, AgentEventMetadata metadata,
            CancellationToken cancellation, double percentUsed, List<List<ChatMessage>> history) {
        cancellation.throwIfCancellationRequested();
        events.publish(AgentEventType.SUMMARIZATION_START, metadata,
                new AgentEventPayload.SummarizationStart(percentUsed, current.size()));
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("agent.name", config.name());
        attributes.put("messages.count", current.size());
        List<ChatMessage> summarized = tracer.trace("agent.summarize", attributes,
                () -> summarizer.summarize(current, cancellation));
        int originalCount = history.stream().mapToInt(List::size).sum();
        events.publish(AgentEventType.SUMMARIZATION_COMPLETE, metadata,
                new AgentEventPayload.SummarizationComplete(summarized.size(), originalCount));
        return new ArrayList<>(summarized);
    }

    private boolean isFinishCall(ToolCall call, ToolDispatch dispatch) {
        Tool<FP, ?> finishTool = config.finishTool();
        return finishTool != null
                && finishTool.name().equals(call.name())
                && dispatch.message().argsWasValid()
                && dispatch.succeeded();
    }

    @SuppressWarnings("unchecked")
    private FP castFinishParams(Object params) {
        return (FP) params;
    }
}
