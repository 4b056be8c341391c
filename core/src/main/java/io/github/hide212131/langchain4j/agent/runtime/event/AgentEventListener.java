package io.github.hide212131.langchain4j.agent.runtime.event;

@FunctionalInterface
public interface AgentEventListener {

    void onEvent(AgentEvent event);
}
