package com.ollamahub.orchestration;

public final class OrchestrationConstants {

    private OrchestrationConstants() {
        // Private constructor to prevent instantiation
    }

    // Reviewer reply layout, shared by the prompt and the parser
    public static final String REVIEW_HEADING = "## Review";
    public static final String FINAL_ANSWER_HEADING = "## Final Answer";
    public static final String REVIEW_HEADING_KEYWORD = "review";
    public static final String FINAL_ANSWER_HEADING_KEYWORD = "final answer";

    // Review prompt
    public static final String REVIEW_PROMPT_INTRO =
            "You are the chief reviewer. Several AI workers have answered the user's question below.";
    public static final String HISTORY_SECTION_TITLE = "# Conversation so far:";
    public static final String QUESTION_SECTION_TITLE = "# User question:";
    public static final String ANSWERS_SECTION_TITLE = "# Worker answers:";
    public static final String WORKER_SECTION_DELIMITER = "---";
    public static final String WORKER_SECTION_HEADER = "[Agent: %s]";
    public static final String HISTORY_USER_LABEL = "[User]";
    public static final String HISTORY_ASSISTANT_LABEL = "[Final Answer]";

    public static final String REVIEW_TASK_INSTRUCTIONS = """
            # Your task:
            1. Review: briefly evaluate each worker's answer, naming the worker you are talking about.
            2. Synthesize: using all of the answers above, correct their mistakes, combine their strengths \
            and write a single final answer of the highest possible quality.

            # Output format (strict):
            %s
            (your evaluation of each worker's answer)

            %s
            (the synthesized final answer)""".formatted(REVIEW_HEADING, FINAL_ANSWER_HEADING);

    // Worker failure details
    public static final String TIMEOUT_DETAIL = "Timed out after %s";
    public static final String CONNECTION_DETAIL = "Connection failed: %s";
    public static final String PROTOCOL_DETAIL = "HTTP error %s";
    public static final String MALFORMED_DETAIL = "Malformed response: %s";
    public static final String UNEXPECTED_DETAIL = "Unexpected error: %s";
}
