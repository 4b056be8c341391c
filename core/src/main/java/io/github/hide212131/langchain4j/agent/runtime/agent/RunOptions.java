package io.github.hide212131.langchain4j.agent.runtime.agent;

import io.github.hide212131.langchain4j.agent.runtime.CancellationToken;
import java.util.Objects;

public record RunOptions(CancellationToken cancellation) {

    private static final RunOptions DEFAULTS = new RunOptions(CancellationToken.none());

    public RunOptions {
        Objects.requireNonNull(cancellation, "cancellation");
    }

    public static RunOptions defaults() {
        return DEFAULTS;
    }

    public static RunOptions withCancellation(CancellationToken cancellation) {
        return new RunOptions(cancellation);
    }
}
