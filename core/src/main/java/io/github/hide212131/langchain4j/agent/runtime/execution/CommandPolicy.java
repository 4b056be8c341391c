package io.github.hide212131.langchain4j.agent.runtime.execution;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/** Allow-list of command patterns. A command is permitted when any pattern is found in it. */
public final class CommandPolicy {

    private static final CommandPolicy ALLOW_ALL = new CommandPolicy(null);

    private final List<Pattern> allowed;

    private CommandPolicy(List<Pattern> allowed) {
        this.allowed = allowed;
    }

    public static CommandPolicy allowAll() {
        return ALLOW_ALL;
    }

    public static CommandPolicy allowing(List<String> regexes) {
        Objects.requireNonNull(regexes, "regexes");
        return new CommandPolicy(regexes.stream().map(Pattern::compile).toList());
    }

    public boolean permits(String command) {
        Objects.requireNonNull(command, "command");
        if (allowed == null) {
            return true;
        }
        return allowed.stream().anyMatch(pattern -> pattern.matcher(command).find());
    }
}
