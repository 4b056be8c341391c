package io.github.hide212131.langchain4j.agent.runtime.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.github.hide212131.langchain4j.agent.infra.config.RuntimeConfig;
import io.github.hide212131.langchain4j.agent.runtime.AgentConfigurationException;
import io.github.hide212131.langchain4j.agent.runtime.message.AssistantMessage;
import io.github.hide212131.langchain4j.agent.runtime.message.ChatMessage;
import io.github.hide212131.langchain4j.agent.runtime.message.ContentBlock;
import io.github.hide212131.langchain4j.agent.runtime.message.SystemMessage;
import io.github.hide212131.langchain4j.agent.runtime.message.TokenUsage;
import io.github.hide212131.langchain4j.agent.runtime.message.ToolCall;
import io.github.hide212131.langchain4j.agent.runtime.message.ToolMessage;
import io.github.hide212131.langchain4j.agent.runtime.message.UserMessage;
import io.github.hide212131.langchain4j.agent.runtime.tool.FinishTool;
import io.github.hide212131.langchain4j.agent.runtime.tool.Tool;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.function.Function;
import org.junit.jupiter.api.Test;

class LangChain4jModelClientTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    @Test
    void generateShouldConvertMessagesAndToolCalls() {
        RecordingChatModel chatModel = new RecordingChatModel(request -> ChatResponse.builder()
                .aiMessage(AiMessage.from("thinking", List.of(ToolExecutionRequest.builder()
                        .id("call-1")
                        .name("finish")
                        .arguments("{\"reason\":\"ok\"}")
                        .build())))
                .tokenUsage(new dev.langchain4j.model.output.TokenUsage(12, 4))
                .build());
        LangChain4jModelClient client = new LangChain4jModelClient(chatModel, "test-model", 8000, FIXED);
        List<Tool<?, ?>> tools = List.of(FinishTool.simple());

        AssistantMessage message = client.generate(List.of(
                SystemMessage.from("system"),
                UserMessage.from("task"),
                new AssistantMessage(io.github.hide212131.langchain4j.agent.runtime.message.Content.empty(),
                        List.of(new ToolCall("code_exec", "{\"cmd\":\"ls\"}", "prev")), null),
                ToolMessage.of("listing", new ToolCall("code_exec", "{}", "prev"), true)), tools);

        assertThat(message.content().asText()).isEqualTo("thinking");
        assertThat(message.toolCalls()).containsExactly(new ToolCall("finish", "{\"reason\":\"ok\"}", "call-1"));
        assertThat(message.tokenUsage()).isEqualTo(new TokenUsage(12, 4, 0));

        ChatRequest request = chatModel.lastRequest;
        assertThat(request.messages()).hasSize(4);
        assertThat(request.messages().get(2)).isInstanceOf(AiMessage.class);
        assertThat(((AiMessage) request.messages().get(2)).toolExecutionRequests()).hasSize(1);
        assertThat(request.messages().get(3)).isInstanceOfSatisfying(ToolExecutionResultMessage.class,
                result -> {
                    assertThat(result.id()).isEqualTo("prev");
                    assertThat(result.text()).isEqualTo("listing");
                });
        assertThat(request.toolSpecifications()).extracting(spec -> spec.name()).containsExactly("finish");

        assertThat(client.metrics().callCount()).isEqualTo(1);
        assertThat(client.metrics().totalTokenCount()).isEqualTo(16);
        assertThat(client.metrics().totalDurationMs()).isZero();
    }

    @Test
    void generateWithoutToolsShouldSendNoSpecifications() {
        RecordingChatModel chatModel = new RecordingChatModel(request -> ChatResponse.builder()
                .aiMessage(AiMessage.from("summary"))
                .build());
        LangChain4jModelClient client = LangChain4jModelClient.usingChatModel(chatModel, "test-model", 8000);

        AssistantMessage message = client.generate(List.of(UserMessage.from("hi")), List.of());

        assertThat(message.tokenUsage()).isNull();
        assertThat(chatModel.lastRequest.toolSpecifications()).isNullOrEmpty();
        assertThat(client.modelIdentifier()).isEqualTo("test-model");
        assertThat(client.maxContextTokens()).isEqualTo(8000);
    }

    @Test
    void imageBlocksShouldBecomeImageContent() {
        RecordingChatModel chatModel = new RecordingChatModel(request -> ChatResponse.builder()
                .aiMessage(AiMessage.from("a cat"))
                .build());
        LangChain4jModelClient client = LangChain4jModelClient.usingChatModel(chatModel, "test-model", 8000);

        client.generate(List.of(UserMessage.from(List.of(
                new ContentBlock.TextBlock("What is this?"),
                new ContentBlock.ImageBlock("data:image/png;base64,iVBORw0KGgo=")))), List.of());

        dev.langchain4j.data.message.UserMessage sent =
                (dev.langchain4j.data.message.UserMessage) chatModel.lastRequest.messages().get(0);
        assertThat(sent.contents()).hasSize(2);
        assertThat(sent.contents().get(1)).isInstanceOfSatisfying(ImageContent.class, image -> {
            assertThat(image.image().base64Data()).isEqualTo("iVBORw0KGgo=");
            assertThat(image.image().mimeType()).isEqualTo("image/png");
        });
    }

    @Test
    void contextLengthFailureShouldBecomeContextOverflow() {
        RecordingChatModel chatModel = new RecordingChatModel(request -> {
            throw new IllegalStateException("This model's maximum context length is 8192 tokens");
        });
        LangChain4jModelClient client = LangChain4jModelClient.usingChatModel(chatModel, "test-model", 8000);

        assertThatThrownBy(() -> client.generate(List.<ChatMessage>of(UserMessage.from("hi")), List.of()))
                .isInstanceOf(ContextOverflowException.class)
                .hasMessageContaining("test-model");
    }

    @Test
    void otherFailuresShouldBecomeModelClientException() {
        RecordingChatModel chatModel = new RecordingChatModel(request -> {
            throw new IllegalStateException("rate limited");
        });
        LangChain4jModelClient client = LangChain4jModelClient.usingChatModel(chatModel, "test-model", 8000);

        assertThatThrownBy(() -> client.generate(List.<ChatMessage>of(UserMessage.from("hi")), List.of()))
                .isExactlyInstanceOf(ModelClientException.class)
                .hasRootCauseMessage("rate limited");
    }

    @Test
    void forOpenAiShouldRequireApiKey() {
        assertThatThrownBy(() -> LangChain4jModelClient.forOpenAi(RuntimeConfig.defaults()))
                .isInstanceOf(AgentConfigurationException.class)
                .hasMessageContaining("OPENAI_API_KEY");
    }

    @Test
    void forOpenAiShouldPassConfigurationToFactory() {
        RuntimeConfig config = new RuntimeConfig(10, 0.5, "test-key", "gpt-test", "http://localhost:8080/v1",
                32_000, Duration.ofSeconds(240));
        RecordingChatModel chatModel = new RecordingChatModel(request -> null);
        RuntimeConfig[] captured = new RuntimeConfig[1];

        LangChain4jModelClient client = LangChain4jModelClient.forOpenAi(config, received -> {
            captured[0] = received;
            return chatModel;
        });

        assertThat(captured[0]).isSameAs(config);
        assertThat(client.modelIdentifier()).isEqualTo("gpt-test");
        assertThat(client.maxContextTokens()).isEqualTo(32_000);
    }

    private static final class RecordingChatModel implements ChatModel {
        private final Function<ChatRequest, ChatResponse> responder;
        ChatRequest lastRequest;

        RecordingChatModel(Function<ChatRequest, ChatResponse> responder) {
            this.responder = responder;
        }

        @Override
        public ChatResponse doChat(ChatRequest request) {
            lastRequest = request;
            return responder.apply(request);
        }
    }
}
