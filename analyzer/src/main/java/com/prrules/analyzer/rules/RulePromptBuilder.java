package com.prrules.analyzer.rules;

/**
 * Builds the prompts sent to a {@link RuleBackend}.
 */
public class RulePromptBuilder {

    static final String SYSTEM_PROMPT =
            "You are an expert software engineer specializing in code quality and best practices.";

    private static final String USER_TEMPLATE = """
            Your task is to extract a specific coding rule or guideline from the following \
            GitHub pull request review comment.

            Context:
            - Repository: %s
            - Pull request title: %s
            - File: %s
            - Line: %s

            Comment:
            "%s"

            The rule must be specific and actionable, focused on code quality, applicable to \
            similar code in the future and written in concise imperative language.

            Answer with a JSON object of this shape:
            {
              "rule_text": "the rule in imperative language",
              "rule_category": "one of naming, style, performance, security, best_practices, error_handling, testing, documentation, architecture, readability, general",
              "rule_severity": "one of critical, high, medium, low, info",
              "explanation": "why the rule matters",
              "examples": ["good example", "bad example"],
              "related_concepts": ["related concept"]
            }

            If the comment contains no coding rule, answer with null.
            """;

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String userPrompt(String commentText, CommentContext context) {
        return USER_TEMPLATE.formatted(
                orEmpty(context != null ? context.repositoryName() : null),
                orEmpty(context != null ? context.pullRequestTitle() : null),
                orEmpty(context != null ? context.filePath() : null),
                context != null && context.lineNumber() != null ? context.lineNumber() : "",
                commentText);
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }
}
