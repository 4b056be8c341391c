package io.github.hide212131.langchain4j.agent.runtime.agent;

import io.github.hide212131.langchain4j.agent.runtime.AgentException;
import io.github.hide212131.langchain4j.agent.runtime.CancellationToken;
import io.github.hide212131.langchain4j.agent.runtime.RunCancelledException;
import io.github.hide212131.langchain4j.agent.runtime.event.AgentEventBus;
import io.github.hide212131.langchain4j.agent.runtime.event.AgentEventMetadata;
import io.github.hide212131.langchain4j.agent.runtime.event.AgentEventPayload;
import io.github.hide212131.langchain4j.agent.runtime.event.AgentEventType;
import io.github.hide212131.langchain4j.agent.runtime.event.LoggingAgentListener;
import io.github.hide212131.langchain4j.agent.runtime.execution.CodeExecutionEnvironment;
import io.github.hide212131.langchain4j.agent.runtime.message.ChatMessage;
import io.github.hide212131.langchain4j.agent.runtime.message.UserMessage;
import io.github.hide212131.langchain4j.agent.runtime.session.SessionConfig;
import io.github.hide212131.langchain4j.agent.runtime.session.SessionLifecycleManager;
import io.github.hide212131.langchain4j.agent.runtime.session.SessionState;
import io.github.hide212131.langchain4j.agent.runtime.tool.FinishSignal;
import io.github.hide212131.langchain4j.agent.runtime.tool.ToolRegistry;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Resources of one agent session: tools, execution environment, uploaded files and skills. The session is opened
 * on the first run and may serve several runs. Closing it saves the last finish paths and disposes everything in
 * reverse order.
 *
 * <p>Runs of one session must not overlap.</p>
 */
public final class AgentSession<FP> implements AutoCloseable {

    private final Agent<FP> agent;
    private final AgentConfig<FP> config;
    private final SessionConfig sessionConfig;
    private final SessionState state;
    private final ToolRegistry registry = new ToolRegistry();
    private final SessionLifecycleManager lifecycle = new SessionLifecycleManager();
    private boolean initialized;
    private boolean closed;
    private FP lastFinishParams;

    AgentSession(Agent<FP> agent, SessionConfig sessionConfig, int depth, CodeExecutionEnvironment parentExecEnv) {
        this.agent = Objects.requireNonNull(agent, "agent");
        this.config = agent.config();
        this.sessionConfig = Objects.requireNonNull(sessionConfig, "sessionConfig");
        Path outputDir = sessionConfig.outputDir().map(dir -> sessionConfig.workingDirectory().resolve(dir))
                .orElse(null);
        this.state = new SessionState(depth, parentExecEnv, outputDir);
    }

    /** Opens the session's resources. Runs call this implicitly. */
    public synchronized void initialize() {
        ensureNotClosed();
        if (initialized) {
            return;
        }
        lifecycle.open(state, sessionConfig, config.tools(), config.finishTool(), registry);
        if (sessionConfig.loggingEnabled()) {
            AgentEventBus.Subscription subscription = agent.events().subscribeAll(new LoggingAgentListener());
            state.disposalStack().push("logging", subscription::close);
        }
        initialized = true;
    }

    public RunResult<FP> run(String task) {
        return run(task, RunOptions.defaults());
    }

    public RunResult<FP> run(String task, RunOptions options) {
        return run(List.of(UserMessage.from(task)), options);
    }

    /**
     * Runs the agent on {@code initialMessages}.
     *
     * @throws RunCancelledException when the cancellation token fires during the run
     */
    public RunResult<FP> run(List<ChatMessage> initialMessages, RunOptions options) {
        Objects.requireNonNull(initialMessages, "initialMessages");
        Objects.requireNonNull(options, "options");
        initialize();
        String runId = UUID.randomUUID().toString();
        AgentEventMetadata metadata = new AgentEventMetadata(config.name(), runId, state.depth(), Instant.now());
        AgentEventBus events = agent.events();
        events.publish(AgentEventType.RUN_START, metadata,
                new AgentEventPayload.RunStart(describe(initialMessages), state.depth()));
        Instant start = Instant.now();
        try {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("agent.name", config.name());
            attributes.put("agent.depth", state.depth());
            attributes.put("agent.run_id", runId);
            RunResult<FP> result = config.tracer().trace("agent.run", attributes,
                    () -> new TurnController<>(config, registry, state, events)
                            .run(initialMessages, runId, options.cancellation()));
            lastFinishParams = result.finishParams();
            events.publish(AgentEventType.RUN_COMPLETE, metadata, new AgentEventPayload.RunComplete(
                    result.finished(), result.runMetadata(), Duration.between(start, Instant.now()),
                    state.outputDir().map(Object::toString).orElse(null)));
            return result;
        } catch (RunCancelledException ex) {
            events.publish(AgentEventType.RUN_CANCELLED, metadata,
                    new AgentEventPayload.RunCancelled(ex.getMessage(), Duration.between(start, Instant.now())));
            throw ex;
        } catch (RuntimeException ex) {
            events.publish(AgentEventType.RUN_ERROR, metadata, new AgentEventPayload.RunError(
                    String.valueOf(ex.getMessage()), ex, Duration.between(start, Instant.now())));
            throw ex;
        }
    }

    /**
     * Runs {@code task} on {@code executor}. Cancelling the returned future requests cancellation of the run,
     * which then stops at its next checkpoint.
     */
    public CompletableFuture<RunResult<FP>> runAsync(String task, Executor executor) {
        return runAsync(task, CancellationToken.create(), executor);
    }

    public CompletableFuture<RunResult<FP>> runAsync(String task, CancellationToken cancellation,
            Executor executor) {
        Objects.requireNonNull(executor, "executor");
        CompletableFuture<RunResult<FP>> future = new CompletableFuture<>() {
            @Override
            public boolean cancel(boolean mayInterruptIfRunning) {
                if (!cancellation.isCancellationRequested()) {
                    cancellation.cancel("Run future was cancelled");
                }
                return super.cancel(mayInterruptIfRunning);
            }
        };
        executor.execute(() -> {
            try {
                future.complete(run(task, RunOptions.withCancellation(cancellation)));
            } catch (RuntimeException ex) {
                future.completeExceptionally(ex);
            }
        });
        return future;
    }

    public Agent<FP> agent() {
        return agent;
    }

    public SessionState state() {
        return state;
    }

    /** Tools active in this session; empty until the session is initialized. */
    public ToolRegistry registry() {
        return registry;
    }

    /** Finish parameters of the most recent completed run; empty when that run did not finish. */
    public Optional<FP> lastFinishParams() {
        return Optional.ofNullable(lastFinishParams);
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Saves the last finish paths and disposes the session.
     *
     * @throws AgentException when saving or disposal fails; every resource is still released
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!initialized) {
            return;
        }
        List<String> paths = lastFinishParams instanceof FinishSignal signal ? signal.paths() : List.of();
        lifecycle.close(state, paths);
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("Session of agent " + config.name() + " is closed");
        }
    }

    private static String describe(List<ChatMessage> messages) {
        return messages.stream().map(message -> message.content().asText()).collect(Collectors.joining("\n"));
    }
}
