package io.github.hide212131.langchain4j.agent.runtime.event;

import java.util.Arrays;

/** Event kinds published on the {@link AgentEventBus}, with their wire names. */
public enum AgentEventType {
    RUN_START("run:start", AgentEventPayload.RunStart.class),
    RUN_COMPLETE("run:complete", AgentEventPayload.RunComplete.class),
    RUN_ERROR("run:error", AgentEventPayload.RunError.class),
    RUN_CANCELLED("run:cancelled", AgentEventPayload.RunCancelled.class),
    TURN_START("turn:start", AgentEventPayload.TurnStart.class),
    TURN_COMPLETE("turn:complete", AgentEventPayload.TurnComplete.class),
    MESSAGE_ASSISTANT("message:assistant", AgentEventPayload.AssistantOutput.class),
    MESSAGE_TOOL("message:tool", AgentEventPayload.ToolOutput.class),
    TOOL_START("tool:start", AgentEventPayload.ToolStart.class),
    TOOL_COMPLETE("tool:complete", AgentEventPayload.ToolComplete.class),
    TOOL_ERROR("tool:error", AgentEventPayload.ToolError.class),
    SUMMARIZATION_START("summarization:start", AgentEventPayload.SummarizationStart.class),
    SUMMARIZATION_COMPLETE("summarization:complete", AgentEventPayload.SummarizationComplete.class);

    private final String wireName;
    private final Class<? extends AgentEventPayload> payloadType;

    AgentEventType(String wireName, Class<? extends AgentEventPayload> payloadType) {
        this.wireName = wireName;
        this.payloadType = payloadType;
    }

    public String wireName() {
        return wireName;
    }

    public Class<? extends AgentEventPayload> payloadType() {
        return payloadType;
    }

    public static AgentEventType fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(wireName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + wireName));
    }
}
