package io.github.hide212131.langchain4j.agent.runtime.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class FinishParamsTest {

    private final Tool<FinishParams, ?> finish = FinishTool.simple();

    @Test
    void singlePathStringShouldBecomeList() {
        FinishParams params = ToolArguments.decode(finish, "{\"reason\":\"r\",\"paths\":\"out.png\"}");

        assertThat(params.paths()).containsExactly("out.png");
    }

    @Test
    void stringifiedArrayShouldBeFlattened() {
        FinishParams params = ToolArguments.decode(finish,
                "{\"reason\":\"r\",\"paths\":[\"[\\\"a.csv\\\", \\\"b.csv\\\"]\", \"c.csv\"]}");

        assertThat(params.paths()).containsExactly("a.csv", "b.csv", "c.csv");
    }

    @Test
    void missingAndEmptyPathsShouldBeDropped() {
        assertThat(ToolArguments.decode(finish, "{\"reason\":\"r\"}").paths()).isEmpty();
        assertThat(ToolArguments.decode(finish, "{\"reason\":\"r\",\"paths\":[\"\", \"x\"]}").paths())
                .containsExactly("x");
        assertThat(ToolArguments.decode(finish, "{\"reason\":\"r\",\"paths\":null}").paths()).isEmpty();
    }

    @Test
    void nonStringPathEntriesShouldFailValidation() {
        assertThatThrownBy(() -> ToolArguments.decode(finish, "{\"reason\":\"r\",\"paths\":[\"a\", 3]}"))
                .isInstanceOf(ToolArgumentsException.class)
                .hasMessageContaining("paths");
        assertThatThrownBy(() -> ToolArguments.decode(finish, "{\"reason\":true}"))
                .isInstanceOf(ToolArgumentsException.class)
                .hasMessageContaining("$.reason must be a string but was boolean");
    }

    @Test
    void missingReasonShouldFailValidation() {
        assertThatThrownBy(() -> ToolArguments.decode(finish, "{\"paths\":[\"x\"]}"))
                .isInstanceOf(ToolArgumentsException.class)
                .hasMessageContaining("reason");
    }

    @Test
    void simpleFinishToolShouldExposeReservedNameAndSchema() {
        assertThat(finish.name()).isEqualTo("finish");
        assertThat(finish.parameters()).hasValueSatisfying(schema -> assertThat(schema.required())
                .containsExactly("reason"));
    }
}
