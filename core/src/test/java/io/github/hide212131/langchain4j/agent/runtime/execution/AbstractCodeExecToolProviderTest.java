package io.github.hide212131.langchain4j.agent.runtime.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class AbstractCodeExecToolProviderTest {

    @Test
    void formatResultShouldOmitEmptySections() {
        String formatted = AbstractCodeExecToolProvider.formatResult(CommandResult.of(0, "", ""));

        assertThat(formatted).isEqualTo("<command_result>\n  <exit_code>0</exit_code>\n</command_result>");
    }

    @Test
    void formatResultShouldIncludeErrorKindAndAdvice() {
        String formatted = AbstractCodeExecToolProvider.formatResult(
                CommandResult.failure("Command timed out", "timeout", "Command exceeded 100ms timeout"));

        assertThat(formatted).contains("<stderr>Command timed out</stderr>", "<error_kind>timeout</error_kind>",
                "<advice>Command exceeded 100ms timeout</advice>");
    }

    @Test
    void longOutputShouldBeTruncated() {
        String output = "x".repeat(10_050);

        String truncated = AbstractCodeExecToolProvider.truncate(output);

        assertThat(truncated).hasSize(10_000 + "\n\n[Output truncated]".length())
                .endsWith("\n\n[Output truncated]");
        assertThat(AbstractCodeExecToolProvider.truncate("short")).isEqualTo("short");
    }

    @Test
    void destinationPathsShouldStayRelative() {
        assertThat(AbstractCodeExecToolProvider.safeDestPath("./data/file.txt")).isEqualTo("data/file.txt");
        assertThatThrownBy(() -> AbstractCodeExecToolProvider.safeDestPath("/etc/passwd"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AbstractCodeExecToolProvider.safeDestPath("a/../../b"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void dockerPathsShouldMapOntoWorkspace() {
        assertThat(DockerCodeExecToolProvider.toHostRelative("/workspace/out/a.png")).isEqualTo("out/a.png");
        assertThat(DockerCodeExecToolProvider.toHostRelative("out/a.png")).isEqualTo("out/a.png");
        assertThatThrownBy(() -> DockerCodeExecToolProvider.toHostRelative("/tmp/a.png"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
