package io.github.hide212131.langchain4j.agent.runtime.tool;

/**
 * Executes a tool with validated parameters. Any exception thrown here is reported back to the model as a tool
 * error rather than failing the run, except {@link io.github.hide212131.langchain4j.agent.runtime.RunCancelledException}.
 *
 * @param <P> parameter type, {@link Void} for tools without parameters
 * @param <M> metadata type
 */
@FunctionalInterface
public interface ToolHandler<P, M> {

    ToolResult<M> execute(P params, ToolContext context) throws Exception;
}
