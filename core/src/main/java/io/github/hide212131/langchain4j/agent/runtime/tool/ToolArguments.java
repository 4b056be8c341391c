package io.github.hide212131.langchain4j.agent.runtime.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.type.LogicalType;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

/** Decodes raw JSON tool arguments into the tool's parameter type and validates them. */
public final class ToolArguments {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true)
            .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
            .withCoercionConfig(LogicalType.Textual, config -> config
                    .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                    .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                    .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail))
            .build();

    private static final Validator VALIDATOR;

    static {
        ValidatorFactory factory = Validation.byDefaultProvider()
                .configure()
                .messageInterpolator(new ParameterMessageInterpolator())
                .buildValidatorFactory();
        VALIDATOR = factory.getValidator();
    }

    private ToolArguments() {
        throw new AssertionError("No instances");
    }

    static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Returns the validated parameters, or {@code null} for tools without parameters. Blank arguments are read as
     * {@code {}}. The JSON is checked against the tool's schema before it is bound, then the bound value is checked
     * with Bean Validation.
     */
    public static <P> P decode(Tool<P, ?> tool, String rawArguments) {
        Class<P> type = tool.parametersType();
        if (type == null) {
            return null;
        }
        String json = rawArguments == null || rawArguments.isBlank() ? "{}" : rawArguments;
        JsonNode tree;
        try {
            tree = MAPPER.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new ToolArgumentsException("Malformed arguments for " + tool.name() + ": " + ex.getOriginalMessage(),
                    ex);
        }
        if (tree == null || !tree.isObject()) {
            throw new ToolArgumentsException("Arguments for " + tool.name() + " must be a JSON object");
        }
        String violation = tool.parameters().map(schema -> ArgumentSchemaValidator.violation(schema, tree))
                .orElse(null);
        if (violation != null) {
            throw new ToolArgumentsException("Invalid arguments for " + tool.name() + ": " + violation);
        }
        P params;
        try {
            params = MAPPER.treeToValue(tree, type);
        } catch (JsonProcessingException ex) {
            throw new ToolArgumentsException("Malformed arguments for " + tool.name() + ": " + ex.getOriginalMessage(),
                    ex);
        } catch (IllegalArgumentException ex) {
            throw new ToolArgumentsException("Invalid arguments for " + tool.name() + ": " + ex.getMessage(), ex);
        }
        Set<ConstraintViolation<P>> violations = VALIDATOR.validate(params);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted(Comparator.naturalOrder())
                    .collect(Collectors.joining(", "));
            throw new ToolArgumentsException("Invalid arguments for " + tool.name() + ": " + details);
        }
        return params;
    }
}
