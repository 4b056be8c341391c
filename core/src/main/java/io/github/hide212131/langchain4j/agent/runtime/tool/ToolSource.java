package io.github.hide212131.langchain4j.agent.runtime.tool;

/** Something an agent can be configured with: a single {@link Tool} or a {@link ToolProvider}. */
public sealed interface ToolSource permits Tool, ToolProvider {
}
