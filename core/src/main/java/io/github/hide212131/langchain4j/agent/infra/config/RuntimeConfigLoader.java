package io.github.hide212131.langchain4j.agent.infra.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves {@link RuntimeConfig} from environment variables, falling back to a {@code .env} file only for keys
 * the environment does not define.
 */
public final class RuntimeConfigLoader {

    static final String ENV_MAX_TURNS = "AGENT_MAX_TURNS";
    static final String ENV_SUMMARIZATION_CUTOFF = "AGENT_SUMMARIZATION_CUTOFF";
    static final String ENV_OPENAI_API_KEY = "OPENAI_API_KEY";
    static final String ENV_OPENAI_MODEL_NAME = "OPENAI_MODEL_NAME";
    static final String ENV_OPENAI_BASE_URL = "OPENAI_BASE_URL";
    static final String ENV_OPENAI_MAX_CONTEXT_TOKENS = "OPENAI_MAX_CONTEXT_TOKENS";
    static final String ENV_OPENAI_TIMEOUT_SECONDS = "OPENAI_TIMEOUT_SECONDS";

    private final Map<String, String> environment;
    private final Dotenv dotenv;

    public RuntimeConfigLoader() {
        this(System.getenv(), Dotenv.configure().ignoreIfMalformed().ignoreIfMissing().load());
    }

    RuntimeConfigLoader(Map<String, String> environment, Dotenv dotenv) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.dotenv = Objects.requireNonNull(dotenv, "dotenv");
    }

    public RuntimeConfig load() {
        int maxTurns = parseInt(ENV_MAX_TURNS, RuntimeConfig.DEFAULT_MAX_TURNS);
        double cutoff = parseCutoff();
        String modelName = trimToNull(resolveWithPriority(ENV_OPENAI_MODEL_NAME));
        int maxContextTokens = parseInt(ENV_OPENAI_MAX_CONTEXT_TOKENS, RuntimeConfig.DEFAULT_MAX_CONTEXT_TOKENS);
        int timeoutSeconds = parseInt(ENV_OPENAI_TIMEOUT_SECONDS, (int) RuntimeConfig.DEFAULT_TIMEOUT.toSeconds());
        return new RuntimeConfig(
                maxTurns,
                cutoff,
                trimToNull(resolveWithPriority(ENV_OPENAI_API_KEY)),
                modelName != null ? modelName : RuntimeConfig.DEFAULT_MODEL_NAME,
                trimToNull(resolveWithPriority(ENV_OPENAI_BASE_URL)),
                maxContextTokens,
                Duration.ofSeconds(timeoutSeconds));
    }

    private int parseInt(String key, int defaultValue) {
        String raw = trimToNull(resolveWithPriority(key));
        if (raw == null) {
            return defaultValue;
        }
        int value;
        try {
            value = Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(key + " must be a positive integer", ex);
        }
        if (value <= 0) {
            throw new IllegalStateException(key + " must be greater than zero");
        }
        return value;
    }

    private double parseCutoff() {
        String raw = trimToNull(resolveWithPriority(ENV_SUMMARIZATION_CUTOFF));
        if (raw == null) {
            return RuntimeConfig.DEFAULT_SUMMARIZATION_CUTOFF;
        }
        double value;
        try {
            value = Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(ENV_SUMMARIZATION_CUTOFF + " must be a number in (0, 1]", ex);
        }
        if (!(value > 0.0 && value <= 1.0)) {
            throw new IllegalStateException(ENV_SUMMARIZATION_CUTOFF + " must be a number in (0, 1]");
        }
        return value;
    }

    private String resolveWithPriority(String key) {
        if (environment.containsKey(key)) {
            return environment.get(key);
        }
        return dotenv.get(key);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
