package io.github.hide212131.langchain4j.agent.runtime.tool;

import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.model.chat.request.json.JsonAnyOfSchema;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks a decoded JSON argument tree against the {@link JsonObjectSchema} a tool declares.
 *
 * <p>Required properties must be present and non-null. Optional properties may be absent or null. Scalars must match
 * the declared type exactly; no coercion between strings, numbers and booleans. Schema kinds without a check here
 * (references, for example) accept any value.</p>
 */
final class ArgumentSchemaValidator {

    private ArgumentSchemaValidator() {
        throw new AssertionError("No instances");
    }

    /** Returns the first violation found, or {@code null} when {@code value} conforms. */
    static String violation(JsonObjectSchema schema, JsonNode value) {
        return check("$", schema, value);
    }

    private static String check(String path, JsonSchemaElement schema, JsonNode value) {
        if (schema instanceof JsonObjectSchema object) {
            return checkObject(path, object, value);
        }
        if (schema instanceof JsonArraySchema array) {
            return checkArray(path, array, value);
        }
        if (schema instanceof JsonAnyOfSchema anyOf) {
            return checkAnyOf(path, anyOf, value);
        }
        if (schema instanceof JsonStringSchema) {
            return value.isTextual() ? null : mismatch(path, "a string", value);
        }
        if (schema instanceof JsonIntegerSchema) {
            return isInteger(value) ? null : mismatch(path, "an integer", value);
        }
        if (schema instanceof JsonNumberSchema) {
            return value.isNumber() ? null : mismatch(path, "a number", value);
        }
        if (schema instanceof JsonBooleanSchema) {
            return value.isBoolean() ? null : mismatch(path, "a boolean", value);
        }
        if (schema instanceof JsonEnumSchema enumeration) {
            if (value.isTextual() && enumeration.enumValues().contains(value.textValue())) {
                return null;
            }
            return path + " must be one of " + enumeration.enumValues();
        }
        return null;
    }

    private static String checkObject(String path, JsonObjectSchema schema, JsonNode value) {
        if (!value.isObject()) {
            return mismatch(path, "an object", value);
        }
        List<String> required = schema.required() == null ? List.of() : schema.required();
        for (String name : required) {
            JsonNode property = value.get(name);
            if (property == null || property.isNull()) {
                return path + "." + name + " is required";
            }
        }
        Map<String, JsonSchemaElement> properties = schema.properties() == null ? Map.of() : schema.properties();
        for (Map.Entry<String, JsonSchemaElement> entry : properties.entrySet()) {
            JsonNode property = value.get(entry.getKey());
            if (property == null || property.isNull()) {
                continue;
            }
            String violation = check(path + "." + entry.getKey(), entry.getValue(), property);
            if (violation != null) {
                return violation;
            }
        }
        return null;
    }

    private static String checkArray(String path, JsonArraySchema schema, JsonNode value) {
        if (!value.isArray()) {
            return mismatch(path, "an array", value);
        }
        if (schema.items() == null) {
            return null;
        }
        for (int i = 0; i < value.size(); i++) {
            String violation = check(path + "[" + i + "]", schema.items(), value.get(i));
            if (violation != null) {
                return violation;
            }
        }
        return null;
    }

    private static String checkAnyOf(String path, JsonAnyOfSchema schema, JsonNode value) {
        for (JsonSchemaElement option : schema.anyOf()) {
            if (check(path, option, value) == null) {
                return null;
            }
        }
        return path + " matches none of the allowed shapes";
    }

    private static boolean isInteger(JsonNode value) {
        if (value.isIntegralNumber()) {
            return true;
        }
        return value.isFloatingPointNumber() && value.doubleValue() == Math.rint(value.doubleValue());
    }

    private static String mismatch(String path, String expected, JsonNode value) {
        return path + " must be " + expected + " but was " + value.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
