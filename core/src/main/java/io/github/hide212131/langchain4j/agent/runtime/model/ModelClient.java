package io.github.hide212131.langchain4j.agent.runtime.model;

import io.github.hide212131.langchain4j.agent.runtime.message.AssistantMessage;
import io.github.hide212131.langchain4j.agent.runtime.message.ChatMessage;
import io.github.hide212131.langchain4j.agent.runtime.tool.Tool;
import java.util.Collection;
import java.util.List;

/**
 * Backend-agnostic access to a chat model that supports tool calling.
 *
 * <p>Implementations throw {@link ContextOverflowException} when the request does not fit the model's context
 * window and {@link ModelClientException} for every other backend failure.</p>
 */
public interface ModelClient {

    AssistantMessage generate(List<ChatMessage> messages, Collection<Tool<?, ?>> tools);

    String modelIdentifier();

    int maxContextTokens();
}
