package io.github.hide212131.langchain4j.agent.runtime.session;

import io.github.hide212131.langchain4j.agent.runtime.AgentException;
import java.util.List;

/**
 * One or more disposers failed while a {@link DisposalStack} was unwound. The first failure is the cause; every
 * failure is also attached as a suppressed exception.
 */
public class DisposalException extends AgentException {

    private static final long serialVersionUID = 1L;

    private final transient List<Throwable> failures;

    public DisposalException(List<Throwable> failures) {
        super(message(failures), failures.isEmpty() ? null : failures.get(0));
        this.failures = List.copyOf(failures);
        for (Throwable failure : this.failures) {
            addSuppressed(failure);
        }
    }

    public List<Throwable> failures() {
        return failures;
    }

    private static String message(List<Throwable> failures) {
        if (failures.size() == 1) {
            return "Disposal failed: " + failures.get(0).getMessage();
        }
        return failures.size() + " errors occurred during disposal";
    }
}
