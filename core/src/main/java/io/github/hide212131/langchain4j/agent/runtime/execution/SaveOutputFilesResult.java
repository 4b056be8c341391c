package io.github.hide212131.langchain4j.agent.runtime.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Files moved or copied out of an environment, and the reason each failed path was not. */
public record SaveOutputFilesResult(List<SavedFile> saved, Map<String, String> failed) {

    public SaveOutputFilesResult {
        saved = List.copyOf(saved);
        failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
    }
}
