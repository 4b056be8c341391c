package io.github.hide212131.langchain4j.agent.runtime.event;

import java.util.Objects;

public record AgentEvent(AgentEventType type, AgentEventMetadata metadata, AgentEventPayload payload) {

    public AgentEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(payload, "payload");
        if (!type.payloadType().isInstance(payload)) {
            throw new IllegalArgumentException(
                    "Payload " + payload.getClass().getSimpleName() + " does not match event " + type.wireName());
        }
    }

    public <P extends AgentEventPayload> P payloadAs(Class<P> payloadType) {
        return payloadType.cast(payload);
    }
}
