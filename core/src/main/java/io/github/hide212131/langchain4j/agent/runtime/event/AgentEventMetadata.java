package io.github.hide212131.langchain4j.agent.runtime.event;

import java.time.Instant;
import java.util.Objects;

/** Identifies where an event came from: agent, run, nesting depth and time. */
public record AgentEventMetadata(String agentName, String runId, int depth, Instant timestamp) {

    public AgentEventMetadata {
        Objects.requireNonNull(agentName, "agentName");
        Objects.requireNonNull(runId, "runId");
        if (depth < 0) {
            throw new IllegalArgumentException("depth");
        }
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public AgentEventMetadata now() {
        return new AgentEventMetadata(agentName, runId, depth, Instant.now());
    }
}
