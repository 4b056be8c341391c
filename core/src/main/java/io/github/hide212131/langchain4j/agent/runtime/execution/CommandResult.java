package io.github.hide212131.langchain4j.agent.runtime.execution;

import java.util.Objects;

/**
 * Outcome of a shell command. {@code errorKind} and {@code advice} are set when the command could not run
 * normally, e.g. on timeout or policy rejection.
 */
public record CommandResult(int exitCode, String stdout, String stderr, String errorKind, String advice) {

    public CommandResult {
        Objects.requireNonNull(stdout, "stdout");
        Objects.requireNonNull(stderr, "stderr");
    }

    public static CommandResult of(int exitCode, String stdout, String stderr) {
        return new CommandResult(exitCode, stdout, stderr, null, null);
    }

    public static CommandResult failure(String stderr, String errorKind, String advice) {
        return new CommandResult(-1, "", stderr, errorKind, advice);
    }
}
