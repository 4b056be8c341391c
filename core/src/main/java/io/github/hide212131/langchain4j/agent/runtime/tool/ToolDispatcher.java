package io.github.hide212131.langchain4j.agent.runtime.tool;

import io.github.hide212131.langchain4j.agent.infra.observability.WorkflowTracer;
import io.github.hide212131.langchain4j.agent.runtime.RunCancelledException;
import io.github.hide212131.langchain4j.agent.runtime.event.AgentEventPayload;
import io.github.hide212131.langchain4j.agent.runtime.event.AgentEventType;
import io.github.hide212131.langchain4j.agent.runtime.message.Content;
import io.github.hide212131.langchain4j.agent.runtime.message.ToolCall;
import io.github.hide212131.langchain4j.agent.runtime.message.ToolMessage;
import io.github.hide212131.langchain4j.agent.runtime.metadata.MetadataAggregator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Runs a single tool call against the registry. Unknown tools, invalid arguments and handler failures are turned
 * into tool messages. Handler failures include {@link Error}s other than {@link VirtualMachineError}. Only
 * cancellation and virtual machine errors escape.
 */
public final class ToolDispatcher {

    static final String INVALID_ARGUMENTS = "Tool arguments are not valid";

    private final ToolRegistry registry;
    private final WorkflowTracer tracer;

    public ToolDispatcher(ToolRegistry registry, WorkflowTracer tracer) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    public ToolDispatch dispatch(ToolCall call, ToolContext context, MetadataAggregator metadata) {
        Objects.requireNonNull(call, "call");
        context.cancellation().throwIfCancellationRequested();
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("agent.name", context.agentName());
        attributes.put("tool.name", call.name());
        attributes.put("agent.depth", context.depth());
        return tracer.trace("agent.tool", attributes, () -> doDispatch(call, context, metadata));
    }

    private ToolDispatch doDispatch(ToolCall call, ToolContext context, MetadataAggregator metadata) {
        Tool<?, ?> tool = registry.find(call.name()).orElse(null);
        if (tool == null) {
            String error = "Error: '" + call.name() + "' is not a valid tool";
            context.events().publish(AgentEventType.TOOL_ERROR, context.eventMetadata(),
                    new AgentEventPayload.ToolError(call.name(), error));
            return new ToolDispatch(ToolMessage.of(error, call, false), null, false);
        }
        return invoke(tool, call, context, metadata);
    }

    private <P, M> ToolDispatch invoke(Tool<P, M> tool, ToolCall call, ToolContext context,
            MetadataAggregator metadata) {
        metadata.register(tool.name());
        P params;
        try {
            params = ToolArguments.decode(tool, call.arguments());
        } catch (ToolArgumentsException ex) {
            context.events().publish(AgentEventType.TOOL_ERROR, context.eventMetadata(),
                    new AgentEventPayload.ToolError(tool.name(), ex.getMessage()));
            return new ToolDispatch(ToolMessage.of(INVALID_ARGUMENTS, call, false), null, false);
        }

        context.events().publish(AgentEventType.TOOL_START, context.eventMetadata(),
                new AgentEventPayload.ToolStart(tool.name(), params));
        ToolResult<M> result;
        try {
            result = tool.handler().execute(params, context);
        } catch (RunCancelledException ex) {
            throw ex;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RunCancelledException("Tool " + tool.name() + " was interrupted", ex);
        } catch (VirtualMachineError ex) {
            throw ex;
        } catch (Exception | Error ex) {
            return handlerFailure(tool, call, context, params, ex);
        }
        if (result == null) {
            result = new ToolResult<>(Content.empty(), null);
        }
        metadata.record(tool.name(), result.metadata());
        context.events().publish(AgentEventType.TOOL_COMPLETE, context.eventMetadata(),
                new AgentEventPayload.ToolComplete(tool.name(), result.content().asText(), true));
        ToolMessage message = new ToolMessage(result.content(), call.toolCallId(), call.name(), true);
        return new ToolDispatch(message, params, true);
    }

    private static ToolDispatch handlerFailure(Tool<?, ?> tool, ToolCall call, ToolContext context, Object params,
            Throwable failure) {
        String error = "Error executing tool: " + failure.getMessage();
        context.events().publish(AgentEventType.TOOL_ERROR, context.eventMetadata(),
                new AgentEventPayload.ToolError(tool.name(), String.valueOf(failure.getMessage())));
        return new ToolDispatch(ToolMessage.of(error, call, true), params, false);
    }
}
