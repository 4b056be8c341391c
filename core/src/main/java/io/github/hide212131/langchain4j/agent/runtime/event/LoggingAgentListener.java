package io.github.hide212131.langchain4j.agent.runtime.event;

import java.util.Locale;
import java.util.Objects;

/** Writes every agent event to an {@link AgentLog}. */
public final class LoggingAgentListener implements AgentEventListener {

    private final AgentLog log;

    public LoggingAgentListener() {
        this(AgentLog.forAgents());
    }

    public LoggingAgentListener(AgentLog log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    @Override
    public void onEvent(AgentEvent event) {
        AgentEventMetadata md = event.metadata();
        AgentEventPayload payload = event.payload();
        String step = event.type().wireName();
        switch (event.type()) {
            case RUN_START -> {
                AgentEventPayload.RunStart start = event.payloadAs(AgentEventPayload.RunStart.class);
                log.info(md, "run", step, "Run started at depth " + start.depth(), start.task(), null);
            }
            case RUN_COMPLETE -> {
                AgentEventPayload.RunComplete complete = event.payloadAs(AgentEventPayload.RunComplete.class);
                log.info(md, "run", step,
                        (complete.finished() ? "Run finished" : "Run stopped without finishing") + " in "
                                + complete.duration().toMillis() + "ms",
                        null, String.valueOf(complete.runMetadata()));
            }
            case RUN_ERROR -> {
                AgentEventPayload.RunError error = event.payloadAs(AgentEventPayload.RunError.class);
                log.error(md, "run", step, "Run failed", error.error());
            }
            case RUN_CANCELLED -> log.warn(md, "run", step,
                    "Run cancelled: " + event.payloadAs(AgentEventPayload.RunCancelled.class).reason(), null);
            case TURN_START -> {
                AgentEventPayload.TurnStart turn = event.payloadAs(AgentEventPayload.TurnStart.class);
                log.fine(md, "turn", step, "Turn " + (turn.turn() + 1) + "/" + turn.maxTurns(), null, null);
            }
            case TURN_COMPLETE -> {
                AgentEventPayload.TurnComplete turn = event.payloadAs(AgentEventPayload.TurnComplete.class);
                log.fine(md, "turn", step, "Turn " + (turn.turn() + 1) + " complete", null,
                        turn.tokenUsage() == null ? null : turn.tokenUsage().toString());
            }
            case MESSAGE_ASSISTANT -> {
                AgentEventPayload.AssistantOutput out = event.payloadAs(AgentEventPayload.AssistantOutput.class);
                log.info(md, "turn", step, "Assistant responded with " + out.toolCalls().size() + " tool call(s)",
                        null, out.content());
            }
            case MESSAGE_TOOL -> {
                AgentEventPayload.ToolOutput out = event.payloadAs(AgentEventPayload.ToolOutput.class);
                log.fine(md, "tool", step, "Tool " + out.name() + " replied", null, out.content());
            }
            case TOOL_START -> {
                AgentEventPayload.ToolStart start = event.payloadAs(AgentEventPayload.ToolStart.class);
                log.info(md, "tool", step, "Calling " + start.name(), String.valueOf(start.arguments()), null);
            }
            case TOOL_COMPLETE -> {
                AgentEventPayload.ToolComplete complete = event.payloadAs(AgentEventPayload.ToolComplete.class);
                log.fine(md, "tool", step, "Tool " + complete.name() + " completed", null, complete.result());
            }
            case TOOL_ERROR -> {
                AgentEventPayload.ToolError error = event.payloadAs(AgentEventPayload.ToolError.class);
                log.warn(md, "tool", step, "Tool " + error.name() + " failed: " + error.error(), null);
            }
            case SUMMARIZATION_START -> {
                AgentEventPayload.SummarizationStart start =
                        event.payloadAs(AgentEventPayload.SummarizationStart.class);
                log.info(md, "summarize", step, String.format(Locale.ROOT,
                        "Context at %.0f%% of window; summarizing %d messages", start.percentUsed() * 100,
                        start.messageCount()), null, null);
            }
            case SUMMARIZATION_COMPLETE -> {
                AgentEventPayload.SummarizationComplete done =
                        event.payloadAs(AgentEventPayload.SummarizationComplete.class);
                log.info(md, "summarize", step, "Summarized " + done.originalMessageCount() + " messages into "
                        + done.summaryMessageCount(), null, null);
            }
            default -> throw new IllegalStateException("Unhandled event " + payload);
        }
    }
}
