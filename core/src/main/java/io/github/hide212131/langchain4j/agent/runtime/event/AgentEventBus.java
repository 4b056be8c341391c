package io.github.hide212131.langchain4j.agent.runtime.event;

import io.github.hide212131.langchain4j.agent.infra.logging.WorkflowLogger;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous publish/subscribe for agent events. Listeners run on the publishing thread in subscription order.
 * A failing listener is logged and does not affect other listeners or the publisher.
 */
public final class AgentEventBus {

    private static final WorkflowLogger LOGGER = new WorkflowLogger(AgentEventBus.class);

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    public Subscription subscribe(AgentEventType type, AgentEventListener listener) {
        Objects.requireNonNull(type, "type");
        return add(new Registration(type, Objects.requireNonNull(listener, "listener")));
    }

    public Subscription subscribeAll(AgentEventListener listener) {
        return add(new Registration(null, Objects.requireNonNull(listener, "listener")));
    }

    public void publish(AgentEventType type, AgentEventMetadata metadata, AgentEventPayload payload) {
        publish(new AgentEvent(type, metadata.now(), payload));
    }

    public void publish(AgentEvent event) {
        Objects.requireNonNull(event, "event");
        for (Registration registration : registrations) {
            if (registration.type != null && registration.type != event.type()) {
                continue;
            }
            try {
                registration.listener.onEvent(event);
            } catch (RuntimeException ex) {
                LOGGER.warn("Event listener failed for {}: {}", event.type().wireName(), ex.toString(), ex);
            }
        }
    }

    public int listenerCount() {
        return registrations.size();
    }

    private Subscription add(Registration registration) {
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    /** Handle returned by subscribe; closing it removes the listener. */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    private static final class Registration {
        private final AgentEventType type;
        private final AgentEventListener listener;

        private Registration(AgentEventType type, AgentEventListener listener) {
            this.type = type;
            this.listener = listener;
        }
    }
}
