package io.github.hide212131.langchain4j.agent.runtime.message;

/**
 * A conversation entry. Consumers switch on {@link #role()}, which is exhaustive over the permitted subtypes.
 */
public sealed interface ChatMessage permits SystemMessage, UserMessage, AssistantMessage, ToolMessage {

    Role role();

    Content content();
}
