package io.github.hide212131.langchain4j.agent.runtime.tool;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;

/**
 * Default finish parameters. {@code paths} accepts a single string, an array, or a JSON-stringified array; all are
 * flattened into one list.
 */
public record FinishParams(
        @NotNull String reason,
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> paths)
        implements FinishSignal {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    public FinishParams {
        paths = normalize(paths);
    }

    public FinishParams(String reason) {
        this(reason, List.of());
    }

    private static List<String> normalize(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        List<String> flattened = new ArrayList<>();
        for (String item : raw) {
            if (item == null || item.isEmpty()) {
                continue;
            }
            if (item.trim().startsWith("[")) {
                flattened.addAll(parseArray(item));
            } else {
                flattened.add(item);
            }
        }
        return List.copyOf(flattened);
    }

    private static List<String> parseArray(String item) {
        try {
            List<String> parsed = ToolArguments.mapper().readValue(item, STRING_LIST);
            return parsed == null ? List.of() : parsed.stream().filter(p -> p != null && !p.isEmpty()).toList();
        } catch (JsonProcessingException ex) {
            return List.of(item);
        }
    }
}
