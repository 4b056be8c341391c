package io.github.hide212131.langchain4j.agent.runtime.model;

import io.github.hide212131.langchain4j.agent.runtime.AgentException;

/** The model backend failed for a reason other than context overflow. */
public class ModelClientException extends AgentException {

    private static final long serialVersionUID = 1L;

    public ModelClientException(String message) {
        super(message);
    }

    public ModelClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
