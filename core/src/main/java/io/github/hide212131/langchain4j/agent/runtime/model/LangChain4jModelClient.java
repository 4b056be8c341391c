package io.github.hide212131.langchain4j.agent.runtime.model;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.github.hide212131.langchain4j.agent.infra.config.RuntimeConfig;
import io.github.hide212131.langchain4j.agent.runtime.AgentConfigurationException;
import io.github.hide212131.langchain4j.agent.runtime.message.AssistantMessage;
import io.github.hide212131.langchain4j.agent.runtime.message.ChatMessage;
import io.github.hide212131.langchain4j.agent.runtime.message.TokenUsage;
import io.github.hide212131.langchain4j.agent.runtime.tool.Tool;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** {@link ModelClient} backed by a LangChain4j {@link ChatModel}. */
public final class LangChain4jModelClient implements ModelClient {

    private final ChatModel chatModel;
    private final String modelName;
    private final int maxContextTokens;
    private final Clock clock;
    private final AtomicInteger callCount = new AtomicInteger();
    private final AtomicLong cumulativeDurationMs = new AtomicLong();
    private final AtomicLong cumulativeInputTokens = new AtomicLong();
    private final AtomicLong cumulativeOutputTokens = new AtomicLong();

    LangChain4jModelClient(ChatModel chatModel, String modelName, int maxContextTokens, Clock clock) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
        this.modelName = Objects.requireNonNull(modelName, "modelName");
        if (maxContextTokens <= 0) {
            throw new IllegalArgumentException("maxContextTokens must be greater than zero");
        }
        this.maxContextTokens = maxContextTokens;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static LangChain4jModelClient usingChatModel(ChatModel chatModel, String modelName, int maxContextTokens) {
        return new LangChain4jModelClient(chatModel, modelName, maxContextTokens, Clock.systemUTC());
    }

    public static LangChain4jModelClient forOpenAi(RuntimeConfig config) {
        return forOpenAi(config, new OpenAiChatModelFactory());
    }

    static LangChain4jModelClient forOpenAi(RuntimeConfig config, ChatModelFactory factory) {
        Objects.requireNonNull(config, "config");
        if (config.apiKey() == null || config.apiKey().isBlank()) {
            throw new AgentConfigurationException("OPENAI_API_KEY must be set");
        }
        ChatModel chatModel = factory.create(config);
        return new LangChain4jModelClient(chatModel, config.modelName(), config.maxContextTokens(),
                Clock.systemUTC());
    }

    @Override
    public AssistantMessage generate(List<ChatMessage> messages, Collection<Tool<?, ?>> tools) {
        ChatRequest.Builder request = ChatRequest.builder().messages(MessageConverter.toLangChain4j(messages));
        if (tools != null && !tools.isEmpty()) {
            request.toolSpecifications(MessageConverter.toSpecifications(tools));
        }
        Instant start = clock.instant();
        ChatResponse response;
        try {
            response = chatModel.chat(request.build());
        } catch (RuntimeException ex) {
            throw ModelErrorClassifier.classify(modelName, ex);
        }
        long durationMs = Duration.between(start, clock.instant()).toMillis();
        if (response == null || response.aiMessage() == null) {
            throw new ModelClientException("Model " + modelName + " returned no message");
        }
        AssistantMessage message = MessageConverter.fromAiMessage(response.aiMessage(), response.tokenUsage());
        recordMetrics(message.tokenUsage(), durationMs);
        return message;
    }

    @Override
    public String modelIdentifier() {
        return modelName;
    }

    @Override
    public int maxContextTokens() {
        return maxContextTokens;
    }

    public ProviderMetrics metrics() {
        return new ProviderMetrics(
                callCount.get(),
                cumulativeDurationMs.get(),
                cumulativeInputTokens.get(),
                cumulativeOutputTokens.get());
    }

    public record ProviderMetrics(int callCount, long totalDurationMs, long totalInputTokens,
            long totalOutputTokens) {
        public long totalTokenCount() {
            return totalInputTokens + totalOutputTokens;
        }
    }

    @FunctionalInterface
    interface ChatModelFactory {
        ChatModel create(RuntimeConfig config);
    }

    private static final class OpenAiChatModelFactory implements ChatModelFactory {

        @Override
        public ChatModel create(RuntimeConfig config) {
            OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                    .apiKey(config.apiKey())
                    .modelName(config.modelName())
                    .timeout(config.timeout());
            config.baseUrlOption().ifPresent(builder::baseUrl);
            return builder.build();
        }
    }

    private void recordMetrics(TokenUsage usage, long durationMs) {
        callCount.incrementAndGet();
        cumulativeDurationMs.addAndGet(durationMs);
        if (usage != null) {
            cumulativeInputTokens.addAndGet(usage.input());
            cumulativeOutputTokens.addAndGet(usage.output());
        }
    }
}
