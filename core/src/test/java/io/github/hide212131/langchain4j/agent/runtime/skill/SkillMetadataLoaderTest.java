package io.github.hide212131.langchain4j.agent.runtime.skill;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SkillMetadataLoaderTest {

    private final SkillMetadataLoader loader = new SkillMetadataLoader();

    @Test
    void loadShouldReadFrontmatterOfEachSkillFolderSorted(@TempDir Path skillsDir) throws IOException {
        write(skillsDir, "xlsx", "---\nname: xlsx\ndescription: Spreadsheet editing\n---\nBody");
        write(skillsDir, "docx", "---\nname: docx\ndescription: \"Word documents: create and edit\"\n---\n");
        write(skillsDir, "broken", "---\nname: broken\n---\n");
        write(skillsDir, "plain", "# no frontmatter");
        Files.createDirectories(skillsDir.resolve("empty"));

        List<SkillMetadata> skills = loader.load(skillsDir);

        assertThat(skills).containsExactly(
                new SkillMetadata("docx", "Word documents: create and edit", "skills/docx"),
                new SkillMetadata("xlsx", "Spreadsheet editing", "skills/xlsx"));
    }

    @Test
    void loadShouldReturnEmptyListForMissingDirectory(@TempDir Path root) {
        assertThat(loader.load(root.resolve("missing"))).isEmpty();
    }

    @Test
    void malformedYamlShouldYieldEmptyFrontmatter() {
        Map<String, Object> frontmatter = loader.parseFrontmatter("---\nname: [unclosed\n---\n");

        assertThat(frontmatter).isEmpty();
    }

    @Test
    void frontmatterShouldKeepAdditionalKeys() {
        Map<String, Object> frontmatter = loader.parseFrontmatter(
                "---\r\nname: pdf\r\ndescription: PDF tools\r\nlicense: MIT\r\n---\r\n# PDF");

        assertThat(frontmatter).containsEntry("name", "pdf").containsEntry("license", "MIT");
    }

    @Test
    void promptSectionShouldListSkillsWithPaths() {
        String section = SkillsPromptSection.format(List.of(new SkillMetadata("pdf", "PDF tools", "skills/pdf")));

        assertThat(section).startsWith("## Available Skills\n\n")
                .contains("1. Read the full instructions: `cat <skill_path>/SKILL.md`")
                .endsWith("\n- **pdf**: PDF tools (`skills/pdf/SKILL.md`)");
        assertThat(SkillsPromptSection.format(List.of())).isEmpty();
    }

    private static void write(Path skillsDir, String folder, String content) throws IOException {
        Path dir = Files.createDirectories(skillsDir.resolve(folder));
        Files.writeString(dir.resolve("SKILL.md"), content);
    }
}
