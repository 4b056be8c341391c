package io.github.hide212131.langchain4j.agent.runtime.message;

import java.util.Objects;

/**
 * Result of one tool call. {@code argsWasValid} is false only when the tool was unknown or its arguments failed
 * validation before the handler ran.
 */
public record ToolMessage(Content content, String toolCallId, String name, boolean argsWasValid)
        implements ChatMessage {

    public ToolMessage {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(name, "name");
    }

    public static ToolMessage of(String text, ToolCall call, boolean argsWasValid) {
        return new ToolMessage(Content.text(text), call.toolCallId(), call.name(), argsWasValid);
    }

    @Override
    public Role role() {
        return Role.TOOL;
    }
}
