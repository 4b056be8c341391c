package io.github.hide212131.langchain4j.agent.runtime.event;

import io.github.hide212131.langchain4j.agent.runtime.message.TokenUsage;
import io.github.hide212131.langchain4j.agent.runtime.message.ToolCall;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Event-specific data. Each {@link AgentEventType} carries exactly one payload type. */
public sealed interface AgentEventPayload {

    record RunStart(String task, int depth) implements AgentEventPayload {
    }

    record RunComplete(boolean finished, Map<String, Object> runMetadata, Duration duration, String outputDir)
            implements AgentEventPayload {
        public RunComplete {
            runMetadata = runMetadata == null ? Map.of() : runMetadata;
        }
    }

    record RunError(String message, Throwable error, Duration duration) implements AgentEventPayload {
    }

    record RunCancelled(String reason, Duration duration) implements AgentEventPayload {
    }

    record TurnStart(int turn, int maxTurns) implements AgentEventPayload {
    }

    /** {@code tokenUsage} is null when the model reported none for this turn. */
    record TurnComplete(int turn, TokenUsage tokenUsage) implements AgentEventPayload {
    }

    record AssistantOutput(String content, List<ToolCall> toolCalls) implements AgentEventPayload {
        public AssistantOutput {
            toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        }
    }

    record ToolOutput(String name, String content, boolean argsWasValid) implements AgentEventPayload {
    }

    record ToolStart(String name, Object arguments) implements AgentEventPayload {
        public ToolStart {
            Objects.requireNonNull(name, "name");
        }
    }

    record ToolComplete(String name, String result, boolean success) implements AgentEventPayload {
    }

    record ToolError(String name, String error) implements AgentEventPayload {
    }

    record SummarizationStart(double percentUsed, int messageCount) implements AgentEventPayload {
    }

    record SummarizationComplete(int summaryMessageCount, int originalMessageCount) implements AgentEventPayload {
    }
}
