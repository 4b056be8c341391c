package io.github.hide212131.langchain4j.agent.runtime.tool;

import io.github.hide212131.langchain4j.agent.runtime.CancellationToken;
import io.github.hide212131.langchain4j.agent.runtime.event.AgentEventBus;
import io.github.hide212131.langchain4j.agent.runtime.event.AgentEventMetadata;
import io.github.hide212131.langchain4j.agent.runtime.execution.CodeExecutionEnvironment;
import io.github.hide212131.langchain4j.agent.runtime.session.SessionState;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Invocation context handed to every tool handler: the calling agent, its run, its session and the cancellation
 * token of the run.
 */
public record ToolContext(
        String agentName,
        String runId,
        SessionState session,
        CancellationToken cancellation,
        AgentEventBus events) {

    public ToolContext {
        Objects.requireNonNull(agentName, "agentName");
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(cancellation, "cancellation");
        Objects.requireNonNull(events, "events");
    }

    public int depth() {
        return session.depth();
    }

    public Optional<CodeExecutionEnvironment> execEnv() {
        return session.execEnv();
    }

    public AgentEventMetadata eventMetadata() {
        return new AgentEventMetadata(agentName, runId, depth(), Instant.now());
    }
}
