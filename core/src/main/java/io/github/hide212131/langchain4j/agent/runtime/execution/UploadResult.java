package io.github.hide212131.langchain4j.agent.runtime.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Destination paths written into an environment, and the reason each failed source was skipped. */
public record UploadResult(List<String> uploaded, Map<String, String> failed) {

    public UploadResult {
        uploaded = List.copyOf(uploaded);
        failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
    }
}
