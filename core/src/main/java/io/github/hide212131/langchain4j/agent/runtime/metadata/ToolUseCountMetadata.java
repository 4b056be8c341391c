package io.github.hide212131.langchain4j.agent.runtime.metadata;

public record ToolUseCountMetadata(int numUses) implements Addable<ToolUseCountMetadata> {

    public static ToolUseCountMetadata once() {
        return new ToolUseCountMetadata(1);
    }

    @Override
    public ToolUseCountMetadata add(ToolUseCountMetadata other) {
        return new ToolUseCountMetadata(numUses + other.numUses);
    }
}
