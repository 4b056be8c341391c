package io.github.hide212131.langchain4j.agent.runtime.message;

public record TokenUsage(long input, long output, long reasoning) {

    public TokenUsage {
        if (input < 0 || output < 0 || reasoning < 0) {
            throw new IllegalArgumentException("token counts must not be negative");
        }
    }

    public long total() {
        return input + output + reasoning;
    }
}
