package io.github.hide212131.langchain4j.agent.runtime.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Listener that keeps every received event in memory. Mostly useful in tests. */
public final class AgentEventCollector implements AgentEventListener {

    private final List<AgentEvent> buffer = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void onEvent(AgentEvent event) {
        buffer.add(Objects.requireNonNull(event, "event"));
    }

    public List<AgentEvent> events() {
        synchronized (buffer) {
            return List.copyOf(buffer);
        }
    }

    public List<AgentEvent> eventsOf(AgentEventType type) {
        return events().stream().filter(event -> event.type() == type).toList();
    }

    public List<AgentEventType> types() {
        return events().stream().map(AgentEvent::type).toList();
    }

    public void clear() {
        buffer.clear();
    }
}
