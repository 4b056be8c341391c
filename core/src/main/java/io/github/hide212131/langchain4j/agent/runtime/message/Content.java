package io.github.hide212131.langchain4j.agent.runtime.message;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Message content: either plain text or an ordered list of blocks. Exactly one of {@code text} and
 * {@code blocks} is non-null.
 */
public record Content(String text, List<ContentBlock> blocks) {

    private static final Content EMPTY = new Content("", null);

    public Content {
        if ((text == null) == (blocks == null)) {
            throw new IllegalArgumentException("Content must be either text or blocks");
        }
        blocks = blocks == null ? null : List.copyOf(blocks);
    }

    public static Content text(String text) {
        return text == null || text.isEmpty() ? EMPTY : new Content(text, null);
    }

    public static Content blocks(List<ContentBlock> blocks) {
        Objects.requireNonNull(blocks, "blocks");
        return new Content(null, blocks);
    }

    public static Content empty() {
        return EMPTY;
    }

    public boolean isText() {
        return text != null;
    }

    public boolean isEmpty() {
        return isText() ? text.isEmpty() : blocks.isEmpty();
    }

    /** Text rendering; media blocks become placeholders. */
    public String asText() {
        if (isText()) {
            return text;
        }
        return blocks.stream().map(Content::render).collect(Collectors.joining("\n"));
    }

    private static String render(ContentBlock block) {
        if (block instanceof ContentBlock.TextBlock textBlock) {
            return textBlock.text();
        }
        if (block instanceof ContentBlock.ImageBlock) {
            return "[image]";
        }
        if (block instanceof ContentBlock.VideoBlock) {
            return "[video]";
        }
        return "[audio]";
    }
}
