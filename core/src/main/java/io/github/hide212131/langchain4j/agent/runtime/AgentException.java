package io.github.hide212131.langchain4j.agent.runtime;

/** Base type of every failure raised by the agent runtime. */
public class AgentException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
