package io.github.hide212131.langchain4j.agent.runtime.agent;

import io.github.hide212131.langchain4j.agent.runtime.CancellationToken;
import io.github.hide212131.langchain4j.agent.runtime.message.AssistantMessage;
import io.github.hide212131.langchain4j.agent.runtime.message.ChatMessage;
import io.github.hide212131.langchain4j.agent.runtime.message.Role;
import io.github.hide212131.langchain4j.agent.runtime.message.SystemMessage;
import io.github.hide212131.langchain4j.agent.runtime.message.UserMessage;
import io.github.hide212131.langchain4j.agent.runtime.model.ModelClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Collapses the conversation after the task context into a single summary message.
 *
 * <p>The task context is everything before the first assistant message, or just the first message when there is
 * no assistant message or it comes first. The remainder is summarized by the same model without tools.</p>
 */
final class ContextSummarizer {

    private final ModelClient client;

    ContextSummarizer(ModelClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    /** Returns the task context followed by one user message carrying the summary. */
    List<ChatMessage> summarize(List<ChatMessage> messages, CancellationToken cancellation) {
        int split = taskContextSize(messages);
        List<ChatMessage> taskContext = messages.subList(0, split);
        List<ChatMessage> tail = messages.subList(split, messages.size());

        List<ChatMessage> request = new ArrayList<>(tail.size() + 2);
        request.add(SystemMessage.from(Prompts.MESSAGE_SUMMARIZER_PROMPT));
        request.addAll(tail);
        request.add(UserMessage.from(Prompts.SUMMARY_REQUEST));

        cancellation.throwIfCancellationRequested();
        AssistantMessage summary = client.generate(request, List.of());

        List<ChatMessage> summarized = new ArrayList<>(taskContext);
        summarized.add(UserMessage.from(Prompts.summaryBridge(summary.content().asText())));
        return summarized;
    }

    static int taskContextSize(List<ChatMessage> messages) {
        for (int i = 0; i < messages.size(); i++) {
            if (messages.get(i).role() == Role.ASSISTANT) {
                return i == 0 ? Math.min(1, messages.size()) : i;
            }
        }
        return Math.min(1, messages.size());
    }
}
