package io.github.hide212131.langchain4j.agent.runtime.message;

import java.util.List;
import java.util.Objects;

public record UserMessage(Content content) implements ChatMessage {

    public UserMessage {
        Objects.requireNonNull(content, "content");
    }

    public static UserMessage from(String text) {
        return new UserMessage(Content.text(text));
    }

    public static UserMessage from(List<ContentBlock> blocks) {
        return new UserMessage(Content.blocks(blocks));
    }

    @Override
    public Role role() {
        return Role.USER;
    }
}
