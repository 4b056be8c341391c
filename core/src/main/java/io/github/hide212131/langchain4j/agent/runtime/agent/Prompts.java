package io.github.hide212131.langchain4j.agent.runtime.agent;

/** Fixed prompt texts used by the runtime. */
public final class Prompts {

    public static final String BASE_SYSTEM_PROMPT = """
            You are an AI agent with access to tools to help complete tasks.

            You should:
            - Use tools when they would help accomplish the task
            - Think step by step and explain your reasoning
            - Call the finish tool when the task is complete

            Available tools will be provided to you. Use them wisely to accomplish your goals.""";

    public static final String MESSAGE_SUMMARIZER_PROMPT = """
            You are summarizing a conversation between a user and an AI assistant.

            Your task is to create a concise summary that preserves the key information:
            - The original task or goal
            - Important findings or results
            - Current progress and state
            - Any critical context needed to continue

            Keep the summary focused and relevant. Omit unnecessary details.""";

    public static final String SUMMARY_REQUEST = "Please provide a concise summary.";

    static final String USER_INPUT_TOOL_NAME = "user_input";

    static final String USER_INPUT_AVAILABLE = "You have access to the user_input tool which allows you to ask the "
            + "user questions when you need clarification or are uncertain about something.";

    static final String USER_INPUT_UNAVAILABLE = "You are not able to interact with the user during the task.";

    private Prompts() {
        throw new AssertionError("No instances");
    }

    public static String summaryBridge(String summary) {
        return "[Previous conversation summarized below]\n\n" + summary + "\n\n[Resuming conversation]";
    }
}
