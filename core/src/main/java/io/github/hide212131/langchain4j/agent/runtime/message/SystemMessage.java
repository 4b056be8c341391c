package io.github.hide212131.langchain4j.agent.runtime.message;

import java.util.Objects;

public record SystemMessage(Content content) implements ChatMessage {

    public SystemMessage {
        Objects.requireNonNull(content, "content");
    }

    public static SystemMessage from(String text) {
        return new SystemMessage(Content.text(text));
    }

    @Override
    public Role role() {
        return Role.SYSTEM;
    }
}
