package io.github.hide212131.langchain4j.agent.runtime.tool;

import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import io.github.hide212131.langchain4j.agent.runtime.metadata.ToolUseCountMetadata;
import jakarta.validation.constraints.NotNull;
import java.util.regex.Pattern;

/**
 * The {@code calculator} tool: evaluates an arithmetic expression built from numbers, {@code + - * /} and
 * parentheses. Evaluation errors are returned as content, not as tool errors.
 */
public final class CalculatorTool {

    public static final String NAME = "calculator";

    public static final JsonObjectSchema PARAMETERS = JsonObjectSchema.builder()
            .addProperty("expression", JsonStringSchema.builder()
                    .description("Mathematical expression to evaluate (e.g., \"2 + 2 * 3\")")
                    .build())
            .required("expression")
            .build();

    private static final Pattern ALLOWED = Pattern.compile("[0-9+\\-*/().\\s]*");

    private CalculatorTool() {
        throw new AssertionError("No instances");
    }

    public record Params(@NotNull String expression) {
    }

    public static Tool<Params, ToolUseCountMetadata> create() {
        return Tool.<Params, ToolUseCountMetadata>builder()
                .name(NAME)
                .description("Evaluate a mathematical expression")
                .parameters(Params.class, PARAMETERS)
                .handler((params, context) -> {
                    String content;
                    try {
                        content = "Result: " + format(evaluate(params.expression()));
                    } catch (IllegalArgumentException ex) {
                        content = "Error evaluating expression: " + ex.getMessage();
                    }
                    return ToolResult.of(content, ToolUseCountMetadata.once());
                })
                .build();
    }

    static double evaluate(String expression) {
        if (!ALLOWED.matcher(expression).matches()) {
            throw new IllegalArgumentException("Expression contains invalid characters");
        }
        Parser parser = new Parser(expression);
        double value = parser.expression();
        parser.skipSpaces();
        if (!parser.atEnd()) {
            throw new IllegalArgumentException("Unexpected '" + parser.peek() + "' at position " + parser.pos);
        }
        return value;
    }

    /** Whole numbers print without a fraction. */
    static String format(double value) {
        if (!Double.isInfinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static final class Parser {

        private final String input;
        private int pos;

        Parser(String input) {
            this.input = input;
        }

        // expression := term (('+' | '-') term)*
        double expression() {
            double value = term();
            while (true) {
                if (accept('+')) {
                    value += term();
                } else if (accept('-')) {
                    value -= term();
                } else {
                    return value;
                }
            }
        }

        // term := factor (('*' | '/') factor)*
        double term() {
            double value = factor();
            while (true) {
                if (accept('*')) {
                    value *= factor();
                } else if (accept('/')) {
                    value /= factor();
                } else {
                    return value;
                }
            }
        }

        double factor() {
            if (accept('+')) {
                return factor();
            }
            if (accept('-')) {
                return -factor();
            }
            if (accept('(')) {
                double value = expression();
                if (!accept(')')) {
                    throw new IllegalArgumentException("Missing ')' at position " + pos);
                }
                return value;
            }
            return number();
        }

        double number() {
            skipSpaces();
            int start = pos;
            while (!atEnd() && (Character.isDigit(peek()) || peek() == '.')) {
                pos++;
            }
            if (start == pos) {
                throw new IllegalArgumentException(atEnd()
                        ? "Unexpected end of expression"
                        : "Unexpected '" + peek() + "' at position " + pos);
            }
            String token = input.substring(start, pos);
            try {
                return Double.parseDouble(token);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid number '" + token + "'", ex);
            }
        }

        boolean accept(char expected) {
            skipSpaces();
            if (!atEnd() && peek() == expected) {
                pos++;
                return true;
            }
            return false;
        }

        void skipSpaces() {
            while (!atEnd() && Character.isWhitespace(peek())) {
                pos++;
            }
        }

        boolean atEnd() {
            return pos >= input.length();
        }

        char peek() {
            return input.charAt(pos);
        }
    }
}
