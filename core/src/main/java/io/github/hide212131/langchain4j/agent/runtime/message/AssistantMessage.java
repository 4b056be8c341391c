package io.github.hide212131.langchain4j.agent.runtime.message;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Model output: text plus the tool calls to run, in order. Token usage is absent when the backend omits it. */
public record AssistantMessage(Content content, List<ToolCall> toolCalls, TokenUsage tokenUsage)
        implements ChatMessage {

    public AssistantMessage {
        Objects.requireNonNull(content, "content");
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static AssistantMessage from(String text) {
        return new AssistantMessage(Content.text(text), List.of(), null);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    public Optional<TokenUsage> usage() {
        return Optional.ofNullable(tokenUsage);
    }

    @Override
    public Role role() {
        return Role.ASSISTANT;
    }
}
