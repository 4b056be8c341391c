package io.github.hide212131.langchain4j.agent.runtime.tool;

import java.util.List;

/**
 * Implemented by finish-tool parameter types that carry a reason and output paths. Sessions move these paths out
 * of the execution environment when they close; sub-agent tools report the reason to the parent.
 */
public interface FinishSignal {

    default String reason() {
        return null;
    }

    default List<String> paths() {
        return List.of();
    }
}
