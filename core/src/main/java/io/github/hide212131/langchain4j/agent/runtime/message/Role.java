package io.github.hide212131.langchain4j.agent.runtime.message;

import java.util.Locale;

/** Author of a {@link ChatMessage}. */
public enum Role {
    SYSTEM,
    USER,
    ASSISTANT,
    TOOL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
