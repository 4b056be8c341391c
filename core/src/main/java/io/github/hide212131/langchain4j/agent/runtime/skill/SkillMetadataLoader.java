package io.github.hide212131.langchain4j.agent.runtime.skill;

import io.github.hide212131.langchain4j.agent.infra.logging.WorkflowLogger;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/**
 * Reads {@code <skillsDir>/<folder>/SKILL.md} frontmatter. Folders without a SKILL.md, or whose frontmatter lacks
 * {@code name} or {@code description}, are skipped.
 */
public final class SkillMetadataLoader {

    public static final String SKILLS_DEST_DIR = "skills";

    private static final String SKILL_FILE = "SKILL.md";
    private static final Pattern FRONTMATTER = Pattern.compile("\\A---\\s*\\R(.*?)\\R---", Pattern.DOTALL);
    private static final WorkflowLogger LOGGER = new WorkflowLogger(SkillMetadataLoader.class);

    public List<SkillMetadata> load(Path skillsDir) {
        Objects.requireNonNull(skillsDir, "skillsDir");
        if (!Files.isDirectory(skillsDir)) {
            return List.of();
        }
        List<Path> folders;
        try (Stream<Path> entries = Files.list(skillsDir)) {
            folders = entries.filter(Files::isDirectory).sorted().toList();
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to list skills directory: " + skillsDir, ex);
        }
        List<SkillMetadata> skills = new ArrayList<>();
        for (Path folder : folders) {
            Path skillFile = folder.resolve(SKILL_FILE);
            if (!Files.isRegularFile(skillFile)) {
                continue;
            }
            String markdown;
            try {
                markdown = Files.readString(skillFile, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                LOGGER.warn("Skipping unreadable skill file {}: {}", skillFile, ex.getMessage());
                continue;
            }
            Map<String, Object> frontmatter = parseFrontmatter(markdown);
            String name = stringValue(frontmatter.get("name"));
            String description = stringValue(frontmatter.get("description"));
            if (name == null || description == null) {
                LOGGER.debug("Skipping skill {} without name or description", folder.getFileName());
                continue;
            }
            skills.add(new SkillMetadata(name, description, SKILLS_DEST_DIR + "/" + folder.getFileName()));
        }
        return List.copyOf(skills);
    }

    /** Returns the YAML frontmatter as a map, or an empty map when there is none or it does not parse. */
    public Map<String, Object> parseFrontmatter(String markdown) {
        Matcher matcher = FRONTMATTER.matcher(markdown);
        if (!matcher.find()) {
            return Map.of();
        }
        try {
            Object loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(matcher.group(1));
            if (loaded instanceof Map<?, ?> map) {
                @SuppressWarnings("unchecked")
                Map<String, Object> typed = (Map<String, Object>) map;
                return typed;
            }
            return Map.of();
        } catch (RuntimeException ex) {
            LOGGER.warn("Ignoring malformed skill frontmatter: {}", ex.getMessage());
            return Map.of();
        }
    }

    private static String stringValue(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
