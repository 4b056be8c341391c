package io.github.hide212131.langchain4j.agent.infra.config;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolved runtime settings for the agent and its OpenAI-compatible model backend.
 *
 * @param apiKey OpenAI API key, may be null when no OpenAI client is built
 * @param baseUrl custom endpoint for OpenAI-compatible gateways, or null
 */
public record RuntimeConfig(
        int maxTurns,
        double summarizationCutoff,
        String apiKey,
        String modelName,
        String baseUrl,
        int maxContextTokens,
        Duration timeout) {

    public static final int DEFAULT_MAX_TURNS = 30;
    public static final double DEFAULT_SUMMARIZATION_CUTOFF = 0.7;
    public static final String DEFAULT_MODEL_NAME = "gpt-5-mini";
    public static final int DEFAULT_MAX_CONTEXT_TOKENS = 128_000;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    public RuntimeConfig {
        if (maxTurns <= 0) {
            throw new IllegalArgumentException("maxTurns must be greater than zero");
        }
        if (!(summarizationCutoff > 0.0 && summarizationCutoff <= 1.0)) {
            throw new IllegalArgumentException("summarizationCutoff must be in (0, 1]");
        }
        Objects.requireNonNull(modelName, "modelName");
        if (maxContextTokens <= 0) {
            throw new IllegalArgumentException("maxContextTokens must be greater than zero");
        }
        Objects.requireNonNull(timeout, "timeout");
    }

    public static RuntimeConfig defaults() {
        return new RuntimeConfig(DEFAULT_MAX_TURNS, DEFAULT_SUMMARIZATION_CUTOFF, null, DEFAULT_MODEL_NAME, null,
                DEFAULT_MAX_CONTEXT_TOKENS, DEFAULT_TIMEOUT);
    }

    public Optional<String> baseUrlOption() {
        return Optional.ofNullable(baseUrl);
    }
}
