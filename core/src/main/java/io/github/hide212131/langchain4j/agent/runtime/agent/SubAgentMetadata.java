package io.github.hide212131.langchain4j.agent.runtime.agent;

import io.github.hide212131.langchain4j.agent.runtime.message.ChatMessage;
import io.github.hide212131.langchain4j.agent.runtime.metadata.Addable;
import io.github.hide212131.langchain4j.agent.runtime.metadata.MetadataAggregator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Message history and run metadata of sub-agent runs, accumulated across calls. */
public record SubAgentMetadata(List<List<ChatMessage>> messageHistory, Map<String, Object> runMetadata)
        implements Addable<SubAgentMetadata> {

    private static final SubAgentMetadata EMPTY = new SubAgentMetadata(List.of(), Map.of());

    public SubAgentMetadata {
        messageHistory = messageHistory.stream().map(List::copyOf).toList();
        runMetadata = Collections.unmodifiableMap(new LinkedHashMap<>(runMetadata));
    }

    public static SubAgentMetadata empty() {
        return EMPTY;
    }

    static SubAgentMetadata of(RunResult<?> result) {
        return new SubAgentMetadata(result.messageHistory(), result.runMetadata());
    }

    @Override
    public SubAgentMetadata add(SubAgentMetadata other) {
        List<List<ChatMessage>> history = new ArrayList<>(messageHistory);
        history.addAll(other.messageHistory);
        Map<String, Object> merged = new LinkedHashMap<>(runMetadata);
        other.runMetadata.forEach((key, value) -> merged.merge(key, value, MetadataAggregator::combine));
        return new SubAgentMetadata(history, merged);
    }
}
