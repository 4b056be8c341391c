package io.github.hide212131.langchain4j.agent.runtime.model;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.AudioContent;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.VideoContent;
import io.github.hide212131.langchain4j.agent.runtime.message.AssistantMessage;
import io.github.hide212131.langchain4j.agent.runtime.message.ChatMessage;
import io.github.hide212131.langchain4j.agent.runtime.message.Content;
import io.github.hide212131.langchain4j.agent.runtime.message.ContentBlock;
import io.github.hide212131.langchain4j.agent.runtime.message.SystemMessage;
import io.github.hide212131.langchain4j.agent.runtime.message.TokenUsage;
import io.github.hide212131.langchain4j.agent.runtime.message.ToolCall;
import io.github.hide212131.langchain4j.agent.runtime.message.ToolMessage;
import io.github.hide212131.langchain4j.agent.runtime.message.UserMessage;
import io.github.hide212131.langchain4j.agent.runtime.tool.Tool;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Converts between runtime messages and LangChain4j chat types. */
final class MessageConverter {

    private static final Pattern DATA_URL = Pattern.compile("^data:([^;,]+)(?:;[^,]*)?;base64,(.*)$", Pattern.DOTALL);

    private MessageConverter() {
        throw new AssertionError("No instances");
    }

    static List<dev.langchain4j.data.message.ChatMessage> toLangChain4j(List<ChatMessage> messages) {
        List<dev.langchain4j.data.message.ChatMessage> converted = new ArrayList<>(messages.size());
        for (ChatMessage message : messages) {
            converted.add(toLangChain4j(message));
        }
        return converted;
    }

    static dev.langchain4j.data.message.ChatMessage toLangChain4j(ChatMessage message) {
        return switch (message.role()) {
            case SYSTEM -> dev.langchain4j.data.message.SystemMessage.from(((SystemMessage) message).content().asText());
            case USER -> toUserMessage((UserMessage) message);
            case ASSISTANT -> toAiMessage((AssistantMessage) message);
            case TOOL -> {
                ToolMessage tool = (ToolMessage) message;
                yield ToolExecutionResultMessage.from(tool.toolCallId(), tool.name(), tool.content().asText());
            }
        };
    }

    static List<ToolSpecification> toSpecifications(Collection<Tool<?, ?>> tools) {
        List<ToolSpecification> specifications = new ArrayList<>(tools.size());
        for (Tool<?, ?> tool : tools) {
            ToolSpecification.Builder builder = ToolSpecification.builder()
                    .name(tool.name())
                    .description(tool.description());
            tool.parameters().ifPresent(builder::parameters);
            specifications.add(builder.build());
        }
        return specifications;
    }

    static AssistantMessage fromAiMessage(AiMessage aiMessage, dev.langchain4j.model.output.TokenUsage usage) {
        List<ToolCall> toolCalls = new ArrayList<>();
        if (aiMessage.hasToolExecutionRequests()) {
            for (ToolExecutionRequest request : aiMessage.toolExecutionRequests()) {
                toolCalls.add(new ToolCall(request.name(), request.arguments(), request.id()));
            }
        }
        return new AssistantMessage(Content.text(aiMessage.text()), toolCalls, toTokenUsage(usage));
    }

    static TokenUsage toTokenUsage(dev.langchain4j.model.output.TokenUsage usage) {
        if (usage == null) {
            return null;
        }
        return new TokenUsage(orZero(usage.inputTokenCount()), orZero(usage.outputTokenCount()), 0);
    }

    private static dev.langchain4j.data.message.UserMessage toUserMessage(UserMessage message) {
        Content content = message.content();
        if (content.isText()) {
            return dev.langchain4j.data.message.UserMessage.from(content.text());
        }
        List<dev.langchain4j.data.message.Content> parts = new ArrayList<>();
        for (ContentBlock block : content.blocks()) {
            parts.add(toContent(block));
        }
        return dev.langchain4j.data.message.UserMessage.from(parts);
    }

    private static dev.langchain4j.data.message.Content toContent(ContentBlock block) {
        if (block instanceof ContentBlock.TextBlock text) {
            return TextContent.from(text.text());
        }
        if (block instanceof ContentBlock.ImageBlock image) {
            Matcher matcher = DATA_URL.matcher(image.dataUrl());
            return matcher.matches() ? ImageContent.from(matcher.group(2), matcher.group(1))
                    : ImageContent.from(image.dataUrl());
        }
        if (block instanceof ContentBlock.AudioBlock audio) {
            Matcher matcher = DATA_URL.matcher(audio.dataUrl());
            return matcher.matches() ? AudioContent.from(matcher.group(2), matcher.group(1))
                    : AudioContent.from(audio.dataUrl());
        }
        ContentBlock.VideoBlock video = (ContentBlock.VideoBlock) block;
        Matcher matcher = DATA_URL.matcher(video.dataUrl());
        return matcher.matches() ? VideoContent.from(matcher.group(2), matcher.group(1))
                : VideoContent.from(video.dataUrl());
    }

    private static AiMessage toAiMessage(AssistantMessage message) {
        String text = message.content().asText();
        if (!message.hasToolCalls()) {
            return AiMessage.from(text);
        }
        List<ToolExecutionRequest> requests = new ArrayList<>();
        for (ToolCall call : message.toolCalls()) {
            requests.add(ToolExecutionRequest.builder()
                    .id(call.toolCallId())
                    .name(call.name())
                    .arguments(call.arguments())
                    .build());
        }
        return text.isEmpty() ? AiMessage.from(requests) : AiMessage.from(text, requests);
    }

    private static long orZero(Integer value) {
        return value == null ? 0 : value;
    }
}
