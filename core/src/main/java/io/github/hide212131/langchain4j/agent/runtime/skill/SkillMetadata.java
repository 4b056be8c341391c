package io.github.hide212131.langchain4j.agent.runtime.skill;

import java.util.Objects;

/**
 * Frontmatter of one skill.
 *
 * @param path location of the skill folder inside the execution environment, e.g. {@code skills/data_analysis}
 */
public record SkillMetadata(String name, String description, String path) {

    public SkillMetadata {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(path, "path");
    }
}
