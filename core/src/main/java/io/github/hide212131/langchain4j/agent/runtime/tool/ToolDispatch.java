package io.github.hide212131.langchain4j.agent.runtime.tool;

import io.github.hide212131.langchain4j.agent.runtime.message.ToolMessage;
import java.util.Objects;

/**
 * Outcome of dispatching one tool call.
 *
 * @param params the validated parameters, or null when validation failed or the tool takes none
 * @param succeeded true when the handler ran and returned normally
 */
public record ToolDispatch(ToolMessage message, Object params, boolean succeeded) {

    public ToolDispatch {
        Objects.requireNonNull(message, "message");
    }
}
