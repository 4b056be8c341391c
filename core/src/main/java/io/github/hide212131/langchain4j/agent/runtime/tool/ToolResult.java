package io.github.hide212131.langchain4j.agent.runtime.tool;

import io.github.hide212131.langchain4j.agent.runtime.message.Content;
import java.util.Objects;

/** Output of a tool handler. {@code metadata} may be null. */
public record ToolResult<M>(Content content, M metadata) {

    public ToolResult {
        Objects.requireNonNull(content, "content");
    }

    public static <M> ToolResult<M> of(String text) {
        return new ToolResult<>(Content.text(text), null);
    }

    public static <M> ToolResult<M> of(String text, M metadata) {
        return new ToolResult<>(Content.text(text), metadata);
    }
}
