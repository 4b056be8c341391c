package io.github.hide212131.langchain4j.agent.runtime.model;

/** The request exceeded the model's context window. */
public class ContextOverflowException extends ModelClientException {

    private static final long serialVersionUID = 1L;

    public ContextOverflowException(String message) {
        super(message);
    }

    public ContextOverflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
