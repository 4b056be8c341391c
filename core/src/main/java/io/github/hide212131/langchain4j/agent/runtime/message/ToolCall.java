package io.github.hide212131.langchain4j.agent.runtime.message;

import java.util.Objects;

/**
 * A tool invocation requested by the model. {@code arguments} is raw JSON text; {@code toolCallId} may be null when
 * the backend does not assign ids.
 */
public record ToolCall(String name, String arguments, String toolCallId) {

    public ToolCall {
        Objects.requireNonNull(name, "name");
        arguments = arguments == null ? "" : arguments;
    }
}
