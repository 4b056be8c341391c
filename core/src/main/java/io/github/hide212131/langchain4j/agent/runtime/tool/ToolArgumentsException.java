package io.github.hide212131.langchain4j.agent.runtime.tool;

import io.github.hide212131.langchain4j.agent.runtime.AgentException;

/** Tool arguments could not be decoded or failed validation. Never reaches the caller of a run. */
public class ToolArgumentsException extends AgentException {

    private static final long serialVersionUID = 1L;

    public ToolArgumentsException(String message) {
        super(message);
    }

    public ToolArgumentsException(String message, Throwable cause) {
        super(message, cause);
    }
}
