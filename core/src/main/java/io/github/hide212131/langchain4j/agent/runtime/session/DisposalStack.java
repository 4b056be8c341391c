package io.github.hide212131.langchain4j.agent.runtime.session;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * LIFO stack of cleanup actions. {@link #dispose()} runs every action in reverse registration order, continues past
 * failures and reports them together as a {@link DisposalException}.
 */
public final class DisposalStack {

    private final Deque<Entry> entries = new ArrayDeque<>();
    private boolean disposed;

    /** Registers {@code resource} so that it is closed on disposal, and returns it. */
    public synchronized <T extends AutoCloseable> T enter(String label, T resource) {
        Objects.requireNonNull(resource, "resource");
        push(label, resource::close);
        return resource;
    }

    public synchronized void push(String label, Disposer disposer) {
        Objects.requireNonNull(disposer, "disposer");
        if (disposed) {
            throw new IllegalStateException("Disposal stack already disposed");
        }
        entries.push(new Entry(label == null ? "resource" : label, disposer));
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isDisposed() {
        return disposed;
    }

    /** Runs all registered disposers once. Later calls do nothing. */
    public void dispose() {
        List<Entry> toRun;
        synchronized (this) {
            if (disposed) {
                return;
            }
            disposed = true;
            toRun = new ArrayList<>(entries);
            entries.clear();
        }
        List<Throwable> failures = new ArrayList<>();
        for (Entry entry : toRun) {
            try {
                entry.disposer.dispose();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                failures.add(ex);
            } catch (Exception ex) {
                failures.add(ex);
            }
        }
        if (!failures.isEmpty()) {
            throw new DisposalException(failures);
        }
    }

    @FunctionalInterface
    public interface Disposer {
        void dispose() throws Exception;
    }

    private record Entry(String label, Disposer disposer) {
    }
}
