package io.github.hide212131.langchain4j.agent.runtime.tool;

import dev.langchain4j.model.chat.request.json.JsonAnyOfSchema;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import io.github.hide212131.langchain4j.agent.runtime.metadata.ToolUseCountMetadata;

/** The reserved {@code finish} tool. Calling it with valid arguments ends the run after the current turn. */
public final class FinishTool {

    public static final String NAME = "finish";

    public static final JsonObjectSchema PARAMETERS = JsonObjectSchema.builder()
            .addProperty("reason", JsonStringSchema.builder()
                    .description("Result of the task, including a summary of what was accomplished and the final "
                            + "answer (if applicable)")
                    .build())
            .addProperty("paths", JsonAnyOfSchema.builder()
                    .description("Output file paths (can be a single string or array of strings). "
                            + "Example: [\"output.png\", \"data.csv\"] or \"output.png\"")
                    .anyOf(JsonStringSchema.builder().build(),
                            JsonArraySchema.builder().items(JsonStringSchema.builder().build()).build())
                    .build())
            .required("reason")
            .build();

    private FinishTool() {
        throw new AssertionError("No instances");
    }

    /** Finish tool with {@link FinishParams} that answers {@code Task completed: <reason>}. */
    public static Tool<FinishParams, ToolUseCountMetadata> simple() {
        return Tool.<FinishParams, ToolUseCountMetadata>builder()
                .name(NAME)
                .description("Signal that the task is complete. You MUST include any files you created or "
                        + "modified in the paths parameter.")
                .parameters(FinishParams.class, PARAMETERS)
                .handler((params, context) -> ToolResult.of("Task completed: " + params.reason(),
                        ToolUseCountMetadata.once()))
                .build();
    }
}
