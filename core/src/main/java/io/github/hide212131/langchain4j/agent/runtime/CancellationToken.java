package io.github.hide212131.langchain4j.agent.runtime;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation flag shared between a caller and a run. The run checks it at the top of each turn and
 * before every model call, tool call and summarization call.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final AtomicReference<String> reason = new AtomicReference<>();

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /** A token that can never be cancelled. */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        cancel("Run was cancelled");
    }

    public void cancel(String why) {
        if (!cancellable) {
            throw new IllegalStateException("This token cannot be cancelled");
        }
        reason.compareAndSet(null, why == null || why.isBlank() ? "Run was cancelled" : why);
    }

    public boolean isCancellationRequested() {
        return reason.get() != null;
    }

    public void throwIfCancellationRequested() {
        String why = reason.get();
        if (why != null) {
            throw new RunCancelledException(why);
        }
    }
}
