package io.github.hide212131.langchain4j.agent.runtime.agent;

import io.github.hide212131.langchain4j.agent.runtime.session.SessionState;
import io.github.hide212131.langchain4j.agent.runtime.skill.SkillsPromptSection;
import io.github.hide212131.langchain4j.agent.runtime.tool.ToolRegistry;

/**
 * Assembles the system prompt: base prompt, user-interaction note, uploaded files, available skills and the
 * agent's own prompt, separated by blank lines.
 */
final class SystemPromptBuilder {

    private SystemPromptBuilder() {
        throw new AssertionError("No instances");
    }

    static String build(ToolRegistry registry, SessionState state, String customPrompt) {
        StringBuilder prompt = new StringBuilder(Prompts.BASE_SYSTEM_PROMPT);
        prompt.append("\n\n").append(registry.contains(Prompts.USER_INPUT_TOOL_NAME)
                ? Prompts.USER_INPUT_AVAILABLE
                : Prompts.USER_INPUT_UNAVAILABLE);
        if (!state.uploadedFilePaths().isEmpty()) {
            prompt.append("\n\nUploaded files:\n");
            for (String path : state.uploadedFilePaths()) {
                prompt.append("- ").append(path).append('\n');
            }
        }
        String skills = SkillsPromptSection.format(state.skillsMetadata());
        if (!skills.isEmpty()) {
            prompt.append("\n\n").append(skills);
        }
        if (customPrompt != null && !customPrompt.isBlank()) {
            prompt.append("\n\n").append(customPrompt);
        }
        return prompt.toString();
    }
}
