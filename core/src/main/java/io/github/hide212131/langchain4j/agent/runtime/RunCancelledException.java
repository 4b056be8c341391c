package io.github.hide212131.langchain4j.agent.runtime;

/** The run observed a cancellation request and stopped. This is an abort outcome, not a run failure. */
public class RunCancelledException extends AgentException {

    private static final long serialVersionUID = 1L;

    public RunCancelledException(String message) {
        super(message);
    }

    public RunCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
