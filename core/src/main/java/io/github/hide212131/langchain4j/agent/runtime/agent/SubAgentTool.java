package io.github.hide212131.langchain4j.agent.runtime.agent;

import io.github.hide212131.langchain4j.agent.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.agent.runtime.RunCancelledException;
import io.github.hide212131.langchain4j.agent.runtime.execution.CodeExecutionEnvironment;
import io.github.hide212131.langchain4j.agent.runtime.execution.SaveOutputFilesResult;
import io.github.hide212131.langchain4j.agent.runtime.execution.UploadResult;
import io.github.hide212131.langchain4j.agent.runtime.message.UserMessage;
import io.github.hide212131.langchain4j.agent.runtime.session.SessionState;
import io.github.hide212131.langchain4j.agent.runtime.tool.FinishSignal;
import io.github.hide212131.langchain4j.agent.runtime.tool.Tool;
import io.github.hide212131.langchain4j.agent.runtime.tool.ToolContext;
import io.github.hide212131.langchain4j.agent.runtime.tool.ToolResult;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Exposes a whole agent as a tool named after it. Each call runs the agent in a child session one level deeper
 * than the caller, copies {@code inputFiles} from the caller's environment into the child's, and copies the
 * child's finish paths back.
 */
public final class SubAgentTool<FP> {

    private static final WorkflowLogger LOGGER = new WorkflowLogger(SubAgentTool.class);

    private final Agent<FP> agent;
    private final boolean reuseSession;
    private final Map<SessionState, AgentSession<FP>> reusedSessions = new IdentityHashMap<>();

    private SubAgentTool(Agent<FP> agent, boolean reuseSession) {
        this.agent = agent;
        this.reuseSession = reuseSession;
    }

    public static <FP> Builder<FP> builder(Agent<FP> agent) {
        return new Builder<>(agent);
    }

    ToolResult<SubAgentMetadata> execute(SubAgentParams params, ToolContext context) {
        Optional<CodeExecutionEnvironment> parentEnv = context.execEnv();
        AgentSession<FP> child = null;
        try {
            child = childSession(context, parentEnv.orElse(null));
            child.initialize();
            copyInputFiles(params.inputFiles(), child, parentEnv);
            RunResult<FP> result = child.run(List.of(UserMessage.from(params.task())),
                    RunOptions.withCancellation(context.cancellation()));
            copyOutputFiles(result, child, parentEnv);
            if (!reuseSession) {
                AgentSession<FP> closing = child;
                child = null;
                closing.close();
            }
            return ToolResult.of(resultContent(result), SubAgentMetadata.of(result));
        } catch (RunCancelledException ex) {
            closeAfterFailure(child, ex);
            throw ex;
        } catch (RuntimeException ex) {
            closeAfterFailure(child, ex);
            LOGGER.warn("Sub-agent {} failed at depth {}: {}", agent.name(), context.depth() + 1, ex.getMessage(),
                    ex);
            return ToolResult.of("<sub_agent_error>" + ex.getMessage() + "</sub_agent_error>",
                    SubAgentMetadata.empty());
        }
    }

    private AgentSession<FP> childSession(ToolContext context, CodeExecutionEnvironment parentEnv) {
        int depth = context.depth() + 1;
        if (!reuseSession) {
            return agent.childSession(depth, parentEnv);
        }
        SessionState parent = context.session();
        synchronized (reusedSessions) {
            AgentSession<FP> existing = reusedSessions.get(parent);
            if (existing != null) {
                return existing;
            }
            AgentSession<FP> created = agent.childSession(depth, parentEnv);
            reusedSessions.put(parent, created);
            parent.disposalStack().push("sub-agent " + agent.name(), () -> {
                synchronized (reusedSessions) {
                    reusedSessions.remove(parent);
                }
                created.close();
            });
            return created;
        }
    }

    private void closeAfterFailure(AgentSession<FP> child, RuntimeException failure) {
        if (child == null || reuseSession) {
            return;
        }
        try {
            child.close();
        } catch (RuntimeException closeFailure) {
            failure.addSuppressed(closeFailure);
        }
    }

    private static void copyInputFiles(List<String> inputFiles, AgentSession<?> child,
            Optional<CodeExecutionEnvironment> parentEnv) {
        Optional<CodeExecutionEnvironment> childEnv = child.state().execEnv();
        if (inputFiles.isEmpty() || childEnv.isEmpty() || parentEnv.isEmpty()) {
            return;
        }
        UploadResult upload = childEnv.get().uploadFrom(inputFiles, parentEnv.get());
        if (!upload.failed().isEmpty()) {
            LOGGER.warn("Failed to copy {} input file(s) into sub-agent: {}", upload.failed().size(),
                    upload.failed());
        }
    }

    private static void copyOutputFiles(RunResult<?> result, AgentSession<?> child,
            Optional<CodeExecutionEnvironment> parentEnv) {
        if (!(result.finishParams() instanceof FinishSignal signal) || signal.paths().isEmpty()) {
            return;
        }
        Optional<CodeExecutionEnvironment> childEnv = child.state().execEnv();
        if (childEnv.isEmpty() || parentEnv.isEmpty()) {
            return;
        }
        SaveOutputFilesResult transfer = childEnv.get().transferOutputFiles(signal.paths(), "", parentEnv.get());
        if (!transfer.failed().isEmpty()) {
            LOGGER.warn("Failed to copy {} output file(s) from sub-agent: {}", transfer.failed().size(),
                    transfer.failed());
        }
    }

    private static String resultContent(RunResult<?> result) {
        StringBuilder content = new StringBuilder("<sub_agent_result>\n");
        if (result.finishParams() instanceof FinishSignal signal && signal.reason() != null) {
            content.append("  <reason>").append(signal.reason()).append("</reason>\n");
        }
        return content.append("</sub_agent_result>").toString();
    }

    /** Builds the tool. Sessions are fresh per call unless {@link #reuseSession(boolean)} is set. */
    public static final class Builder<FP> {
        private final Agent<FP> agent;
        private String description;
        private String systemPrompt;
        private boolean reuseSession;

        private Builder(Agent<FP> agent) {
            this.agent = Objects.requireNonNull(agent, "agent");
        }

        public Builder<FP> description(String description) {
            this.description = description;
            return this;
        }

        /** Replaces the agent-specific system prompt of the delegated agent. */
        public Builder<FP> systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        /** Keeps one child session per calling session, closed together with the caller's session. */
        public Builder<FP> reuseSession(boolean reuseSession) {
            this.reuseSession = reuseSession;
            return this;
        }

        public Tool<SubAgentParams, SubAgentMetadata> build() {
            Agent<FP> delegate = systemPrompt == null ? agent : agent.withSystemPrompt(systemPrompt);
            SubAgentTool<FP> bridge = new SubAgentTool<>(delegate, reuseSession);
            return Tool.<SubAgentParams, SubAgentMetadata>builder()
                    .name(agent.name())
                    .description(description != null ? description
                            : "Delegate a task to the " + agent.name() + " sub-agent")
                    .parameters(SubAgentParams.class, SubAgentParams.SCHEMA)
                    .handler(bridge::execute)
                    .build();
        }
    }
}
