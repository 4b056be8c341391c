package io.github.hide212131.langchain4j.agent.runtime.agent;

import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import java.util.Objects;

/**
 * Arguments of a sub-agent tool call.
 *
 * @param task what the sub-agent should do
 * @param inputFiles paths in the caller's environment to copy into the sub-agent's environment
 */
public record SubAgentParams(
        @NotBlank String task,
        List<String> inputFiles) {

    static final JsonObjectSchema SCHEMA = JsonObjectSchema.builder()
            .addProperty("task", JsonStringSchema.builder()
                    .description("The task to delegate to the sub-agent")
                    .build())
            .addProperty("inputFiles", JsonArraySchema.builder()
                    .description("Files from your environment the sub-agent needs")
                    .items(JsonStringSchema.builder().build())
                    .build())
            .required("task")
            .build();

    public SubAgentParams {
        inputFiles = inputFiles == null ? List.of()
                : inputFiles.stream().filter(Objects::nonNull).filter(path -> !path.isBlank()).toList();
    }

    public SubAgentParams(String task) {
        this(task, List.of());
    }
}
