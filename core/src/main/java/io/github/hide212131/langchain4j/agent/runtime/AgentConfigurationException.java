package io.github.hide212131.langchain4j.agent.runtime;

/**
 * Invalid agent or session configuration. Raised at construction or session initialization, before any turn
 * runs, and never recovered.
 */
public class AgentConfigurationException extends AgentException {

    private static final long serialVersionUID = 1L;

    public AgentConfigurationException(String message) {
        super(message);
    }

    public AgentConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
