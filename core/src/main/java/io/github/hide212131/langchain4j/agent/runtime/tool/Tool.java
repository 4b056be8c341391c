package io.github.hide212131.langchain4j.agent.runtime.tool;

import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import java.util.Objects;
import java.util.Optional;

/**
 * A named capability the model can call.
 *
 * <p>Arguments are JSON text decoded into {@code parametersType} and validated with Bean Validation before the
 * handler runs. A tool without parameters has no schema and receives {@code null}.</p>
 *
 * @param <P> parameter type
 * @param <M> metadata type produced by the handler
 */
public final class Tool<P, M> implements ToolSource {

    private final String name;
    private final String description;
    private final JsonObjectSchema parameters;
    private final Class<P> parametersType;
    private final ToolHandler<P, M> handler;

    private Tool(Builder<P, M> builder) {
        if (builder.name == null || builder.name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        this.name = builder.name;
        this.description = Objects.requireNonNullElse(builder.description, "");
        this.parameters = builder.parameters;
        this.parametersType = builder.parametersType;
        this.handler = Objects.requireNonNull(builder.handler, "handler");
        if ((parameters == null) != (parametersType == null)) {
            throw new IllegalArgumentException("Tool " + name + " needs both a schema and a parameter type, or neither");
        }
    }

    public static <P, M> Builder<P, M> builder() {
        return new Builder<>();
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public Optional<JsonObjectSchema> parameters() {
        return Optional.ofNullable(parameters);
    }

    /** Null for tools without parameters. */
    public Class<P> parametersType() {
        return parametersType;
    }

    public ToolHandler<P, M> handler() {
        return handler;
    }

    @Override
    public String toString() {
        return "Tool[" + name + "]";
    }

    public static final class Builder<P, M> {
        private String name;
        private String description;
        private JsonObjectSchema parameters;
        private Class<P> parametersType;
        private ToolHandler<P, M> handler;

        private Builder() {
        }

        public Builder<P, M> name(String name) {
            this.name = name;
            return this;
        }

        public Builder<P, M> description(String description) {
            this.description = description;
            return this;
        }

        public Builder<P, M> parameters(Class<P> parametersType, JsonObjectSchema schema) {
            this.parametersType = Objects.requireNonNull(parametersType, "parametersType");
            this.parameters = Objects.requireNonNull(schema, "schema");
            return this;
        }

        public Builder<P, M> handler(ToolHandler<P, M> handler) {
            this.handler = handler;
            return this;
        }

        public Tool<P, M> build() {
            return new Tool<>(this);
        }
    }
}
