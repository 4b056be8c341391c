package io.github.hide212131.langchain4j.agent.runtime.model;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Locale;
import java.util.Set;

/** Maps backend failures onto {@link ContextOverflowException} or {@link ModelClientException}. */
public final class ModelErrorClassifier {

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_INVALID_REQUEST_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InvalidRequestException";

    private ModelErrorClassifier() {
    }

    public static ModelClientException classify(String modelIdentifier, RuntimeException failure) {
        if (failure instanceof ModelClientException modelFailure) {
            return modelFailure;
        }
        String message = "Model " + modelIdentifier + " failed: " + failure.getMessage();
        if (isContextOverflow(failure)) {
            return new ContextOverflowException(message, failure);
        }
        return new ModelClientException(message, failure);
    }

    /** Walks the cause chain looking for a context-length failure. */
    public static boolean isContextOverflow(Throwable throwable) {
        Set<Throwable> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            if (isContextMessage(current.getMessage())) {
                return true;
            }
            if (CLASS_INVALID_REQUEST_EXCEPTION.equals(current.getClass().getName())
                    && mentionsTokenLimit(current.getMessage())) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean mentionsTokenLimit(String message) {
        if (message == null) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        return normalized.contains("tokens") && (normalized.contains("maximum") || normalized.contains("limit"));
    }

    private static boolean isContextMessage(String message) {
        if (message == null || message.isBlank()) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        return normalized.contains("context length")
                || normalized.contains("context window")
                || normalized.contains("context_length_exceeded")
                || normalized.contains("maximum context")
                || normalized.contains("token limit exceeded")
                || normalized.contains("prompt is too long");
    }
}
