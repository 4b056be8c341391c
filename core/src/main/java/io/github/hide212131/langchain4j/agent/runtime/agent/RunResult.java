package io.github.hide212131.langchain4j.agent.runtime.agent;

import io.github.hide212131.langchain4j.agent.runtime.message.ChatMessage;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a run.
 *
 * @param finishParams parameters of the successful finish call, null when the run did not finish or the finish
 *     tool takes no parameters
 * @param finished whether the finish tool was called with valid arguments and succeeded
 * @param messageHistory one message group per summarization epoch, oldest first
 * @param runMetadata aggregated metadata keyed by tool name, plus {@code token_usage}
 */
public record RunResult<FP>(
        FP finishParams,
        boolean finished,
        List<List<ChatMessage>> messageHistory,
        Map<String, Object> runMetadata) {

    public RunResult {
        messageHistory = messageHistory.stream().map(List::copyOf).toList();
        runMetadata = Collections.unmodifiableMap(new LinkedHashMap<>(runMetadata));
    }

    public Optional<FP> finish() {
        return Optional.ofNullable(finishParams);
    }

    /** Messages of the most recent group. */
    public List<ChatMessage> lastMessages() {
        return messageHistory.isEmpty() ? List.of() : messageHistory.get(messageHistory.size() - 1);
    }
}
