package io.github.hide212131.langchain4j.agent.runtime.message;

import java.util.Objects;

/**
 * One block of multimodal message content. Media blocks carry a data URL; the runtime passes them through to the
 * model client without interpreting them.
 */
public sealed interface ContentBlock {

    record TextBlock(String text) implements ContentBlock {
        public TextBlock {
            Objects.requireNonNull(text, "text");
        }
    }

    record ImageBlock(String dataUrl) implements ContentBlock {
        public ImageBlock {
            Objects.requireNonNull(dataUrl, "dataUrl");
        }
    }

    record VideoBlock(String dataUrl) implements ContentBlock {
        public VideoBlock {
            Objects.requireNonNull(dataUrl, "dataUrl");
        }
    }

    record AudioBlock(String dataUrl) implements ContentBlock {
        public AudioBlock {
            Objects.requireNonNull(dataUrl, "dataUrl");
        }
    }
}
