package io.github.hide212131.langchain4j.agent.runtime.tool;

import java.util.List;

/**
 * Factory of tools with a lifecycle. Within one session {@link #initialize()} is called once, then
 * {@link #getTools()} once, and {@link #close()} when the session is disposed. The provider owns the tools it
 * returns.
 */
public non-sealed interface ToolProvider extends ToolSource, AutoCloseable {

    default void initialize() throws Exception {
    }

    List<Tool<?, ?>> getTools() throws Exception;

    @Override
    void close() throws Exception;
}
