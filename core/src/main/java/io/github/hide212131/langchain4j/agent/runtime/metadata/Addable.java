package io.github.hide212131.langchain4j.agent.runtime.metadata;

/**
 * Metadata that can be folded across tool calls. {@code add} must not mutate either operand.
 *
 * @param <T> the implementing type
 */
public interface Addable<T extends Addable<T>> {

    T add(T other);
}
