package io.github.hide212131.langchain4j.agent.runtime.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.langchain4j.agent.runtime.AgentConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InputFileResolverTest {

    @TempDir
    Path base;

    private InputFileResolver resolver;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(base.resolve("data/raw"));
        Files.writeString(base.resolve("data/a.csv"), "a");
        Files.writeString(base.resolve("data/b.csv"), "b");
        Files.writeString(base.resolve("data/raw/c.csv"), "c");
        Files.writeString(base.resolve("notes.txt"), "n");
        resolver = new InputFileResolver(base);
    }

    @Test
    void globShouldMatchFilesInOneDirectory() {
        assertThat(resolver.resolve(List.of("data/*.csv")))
                .containsExactly(abs("data/a.csv"), abs("data/b.csv"));
    }

    @Test
    void doubleStarShouldMatchNestedFiles() {
        assertThat(resolver.resolve(List.of("data/**.csv")))
                .containsExactlyInAnyOrder(abs("data/a.csv"), abs("data/b.csv"), abs("data/raw/c.csv"));
    }

    @Test
    void literalPathsShouldBeKeptAndDuplicatesRemoved() {
        assertThat(resolver.resolve(List.of("notes.txt", "data/a.csv", "data/*.csv")))
                .containsExactly(abs("notes.txt"), abs("data/a.csv"), abs("data/b.csv"));
    }

    @Test
    void globWithoutMatchesShouldFail() {
        assertThatThrownBy(() -> resolver.resolve(List.of("*.pdf")))
                .isInstanceOf(AgentConfigurationException.class)
                .hasMessageContaining("*.pdf");
    }

    @Test
    void globDetectionShouldRecognizeWildcards() {
        assertThat(InputFileResolver.isGlob("*.csv")).isTrue();
        assertThat(InputFileResolver.isGlob("file?.txt")).isTrue();
        assertThat(InputFileResolver.isGlob("[ab].txt")).isTrue();
        assertThat(InputFileResolver.isGlob("plain/file.txt")).isFalse();
    }

    private Path abs(String relative) {
        return base.toAbsolutePath().normalize().resolve(relative);
    }
}
