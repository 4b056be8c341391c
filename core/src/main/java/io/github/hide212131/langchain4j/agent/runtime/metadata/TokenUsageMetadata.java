package io.github.hide212131.langchain4j.agent.runtime.metadata;

import io.github.hide212131.langchain4j.agent.runtime.message.TokenUsage;

/** Token counts summed over every model call of a run. */
public record TokenUsageMetadata(long input, long output, long reasoning) implements Addable<TokenUsageMetadata> {

    public static TokenUsageMetadata from(TokenUsage usage) {
        return new TokenUsageMetadata(usage.input(), usage.output(), usage.reasoning());
    }

    public long total() {
        return input + output + reasoning;
    }

    @Override
    public TokenUsageMetadata add(TokenUsageMetadata other) {
        return new TokenUsageMetadata(input + other.input, output + other.output, reasoning + other.reasoning);
    }
}
