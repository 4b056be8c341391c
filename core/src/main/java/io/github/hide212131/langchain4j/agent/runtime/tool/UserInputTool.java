package io.github.hide212131.langchain4j.agent.runtime.tool;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import io.github.hide212131.langchain4j.agent.runtime.metadata.ToolUseCountMetadata;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * The {@code user_input} tool: asks the person running the session a single question and returns the answer.
 * Registering it switches the system prompt from "no user interaction" to the user interaction note.
 */
public final class UserInputTool {

    public static final String NAME = "user_input";

    public static final JsonObjectSchema PARAMETERS = JsonObjectSchema.builder()
            .addProperty("question", JsonStringSchema.builder()
                    .description("A single question to ask the user (*not* multiple questions)")
                    .build())
            .addProperty("questionType", JsonEnumSchema.builder()
                    .enumValues("text", "choice", "confirm")
                    .description("Type of question: 'text' for free-form, 'choice' for multiple choice, "
                            + "'confirm' for yes/no")
                    .build())
            .addProperty("choices", JsonArraySchema.builder()
                    .items(JsonStringSchema.builder().build())
                    .description("List of valid choices (required when questionType is 'choice')")
                    .build())
            .addProperty("default", JsonStringSchema.builder()
                    .description("Default value if user presses Enter without input")
                    .build())
            .required("question")
            .build();

    private static final Set<String> YES = Set.of("y", "yes", "true", "1");
    private static final Set<String> NO = Set.of("n", "no", "false", "0");

    private UserInputTool() {
        throw new AssertionError("No instances");
    }

    public enum QuestionType {
        @JsonProperty("text") TEXT,
        @JsonProperty("choice") CHOICE,
        @JsonProperty("confirm") CONFIRM
    }

    public record Params(
            @NotBlank String question,
            QuestionType questionType,
            List<String> choices,
            @JsonProperty("default") String defaultValue) {

        public Params {
            questionType = Objects.requireNonNullElse(questionType, QuestionType.TEXT);
            choices = choices == null ? List.of() : List.copyOf(choices);
            defaultValue = Objects.requireNonNullElse(defaultValue, "");
        }

        @AssertTrue(message = "choices is required when questionType is 'choice'")
        public boolean isChoicesGivenForChoice() {
            return questionType != QuestionType.CHOICE || !choices.isEmpty();
        }
    }

    /** Line-oriented channel to the user. */
    public interface UserConsole {

        /** Shows {@code prompt} and returns the next line, or null when the input is exhausted. */
        String readLine(String prompt) throws IOException;

        void println(String message);

        static UserConsole system() {
            return new StreamConsole(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                    System.out);
        }
    }

    /** Tool that prompts on standard input and output. */
    public static Tool<Params, ToolUseCountMetadata> create() {
        return create(UserConsole.system());
    }

    public static Tool<Params, ToolUseCountMetadata> create(UserConsole console) {
        Objects.requireNonNull(console, "console");
        return Tool.<Params, ToolUseCountMetadata>builder()
                .name(NAME)
                .description("Ask the user a single question when you need clarification or are uncertain. "
                        + "Supports 'text' (free-form), 'choice' (pick from a list of choices), and 'confirm' "
                        + "(yes/no). Returns the user's response. There should only EVER be one question per call "
                        + "to this tool. If you need multiple questions, call this tool multiple times.")
                .parameters(Params.class, PARAMETERS)
                .handler((params, context) -> {
                    context.cancellation().throwIfCancellationRequested();
                    String answer = switch (params.questionType()) {
                        case CONFIRM -> confirm(console, params);
                        case CHOICE -> choose(console, params);
                        case TEXT -> text(console, params);
                    };
                    return ToolResult.of(answer, ToolUseCountMetadata.once());
                })
                .build();
    }

    private static String confirm(UserConsole console, Params params) throws IOException {
        String defaultAnswer = params.defaultValue().isEmpty() ? null : yesNo(params.defaultValue());
        String prompt = params.question().trim()
                + (defaultAnswer == null ? "" : " [default: " + defaultAnswer + "]") + " (y/n): ";
        while (true) {
            String raw = read(console, prompt);
            String answer = raw.isBlank() && defaultAnswer != null ? defaultAnswer : yesNo(raw);
            if (answer != null) {
                return answer;
            }
            console.println("Please answer 'y'/'n' (or 'yes'/'no').");
        }
    }

    private static String choose(UserConsole console, Params params) throws IOException {
        String options = String.join(", ", params.choices());
        console.println("Choices: " + options);
        String prompt = params.question().trim() + defaultSuffix(params) + ": ";
        while (true) {
            String raw = read(console, prompt).trim();
            String candidate = raw.isEmpty() ? params.defaultValue() : raw;
            if (params.choices().contains(candidate)) {
                return candidate;
            }
            console.println("Please choose one of: " + options);
        }
    }

    private static String text(UserConsole console, Params params) throws IOException {
        String raw = read(console, params.question().trim() + defaultSuffix(params) + ": ");
        return raw.isBlank() ? params.defaultValue() : raw;
    }

    private static String read(UserConsole console, String prompt) throws IOException {
        String line = console.readLine(prompt);
        if (line == null) {
            throw new IOException("User input closed before an answer was given");
        }
        return line;
    }

    private static String defaultSuffix(Params params) {
        return params.defaultValue().isEmpty() ? "" : " [default: " + params.defaultValue() + "]";
    }

    static String yesNo(String input) {
        String normalized = input.trim().toLowerCase(Locale.ROOT);
        if (YES.contains(normalized)) {
            return "yes";
        }
        if (NO.contains(normalized)) {
            return "no";
        }
        return null;
    }

    private static final class StreamConsole implements UserConsole {

        private final BufferedReader in;
        private final PrintStream out;

        StreamConsole(BufferedReader in, PrintStream out) {
            this.in = in;
            this.out = out;
        }

        @Override
        public synchronized String readLine(String prompt) throws IOException {
            out.println();
            out.print(prompt);
            out.flush();
            return in.readLine();
        }

        @Override
        public void println(String message) {
            out.println(message);
        }
    }
}
