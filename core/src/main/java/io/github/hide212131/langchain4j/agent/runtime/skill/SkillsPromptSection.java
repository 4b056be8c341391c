package io.github.hide212131.langchain4j.agent.runtime.skill;

import java.util.ArrayList;
import java.util.List;

/** Renders the "Available Skills" part of the system prompt. */
public final class SkillsPromptSection {

    private SkillsPromptSection() {
        throw new AssertionError("No instances");
    }

    /** Returns an empty string when there are no skills. */
    public static String format(List<SkillMetadata> skills) {
        if (skills.isEmpty()) {
            return "";
        }
        List<String> lines = new ArrayList<>(List.of(
                "## Available Skills",
                "",
                "You have access to the following skills located in the `skills/` directory. Each skill contains a "
                        + "SKILL.md file with detailed instructions and potentially bundled scripts.",
                "",
                "To use a skill:",
                "1. Read the full instructions: `cat <skill_path>/SKILL.md`",
                "2. Follow the instructions and use any bundled resources as described",
                ""));
        for (SkillMetadata skill : skills) {
            lines.add("- **" + skill.name() + "**: " + skill.description() + " (`" + skill.path() + "/SKILL.md`)");
        }
        return String.join("\n", lines);
    }
}
