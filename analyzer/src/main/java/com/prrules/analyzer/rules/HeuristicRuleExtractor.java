package com.prrules.analyzer.rules;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern and keyword based rule extraction. Deterministic: the same text and
 * context always produce the same candidate.
 *
 * <p>Two tiers are tried in order. First an ordered list of phrase patterns
 * ("should always ...", "avoid ...", "prefer ... over ...") where the first match
 * wins and the clause it starts becomes the rule. Then the first sentence that
 * opens with an imperative verb.</p>
 */
public class HeuristicRuleExtractor {

    public static final String EXTRACTOR_ID = "heuristic";

    private static final String CLAUSE = "[^.!?\\n]+";

    private static final List<RulePattern> PATTERNS = List.of(
            new RulePattern("should/never rule", "\\bshould\\s+(?:always|never)\\s+" + CLAUSE),
            new RulePattern("avoidance rule", "\\bavoid\\s+" + CLAUSE),
            new RulePattern("substitution rule", "\\buse\\s+" + CLAUSE + "?\\s+instead\\b(?:\\s+of\\s+" + CLAUSE + ")?"),
            new RulePattern("preference rule", "\\bprefer\\s+" + CLAUSE + "?\\s+over\\b[^.!?\\n]*"),
            new RulePattern("convention rule", "\\bfollow\\s+" + CLAUSE + "?\\s+conventions?\\b[^.!?\\n]*"),
            new RulePattern("ensurance rule", "\\bensure\\s+" + CLAUSE + "?\\s+is\\s+" + CLAUSE),
            new RulePattern("instruction rule", "\\bmake\\s+sure\\s+to\\s+" + CLAUSE),
            new RulePattern("reminder rule", "\\bremember\\s+to\\s+" + CLAUSE),
            new RulePattern("prohibition rule", "\\bdo\\s+not\\s+" + CLAUSE),
            new RulePattern("requirement rule", "\\balways\\s+" + CLAUSE),
            new RulePattern("prohibition rule", "\\bnever\\s+" + CLAUSE)
    );

    static final Set<String> IMPERATIVE_VERBS = Set.of(
            "use", "avoid", "follow", "ensure", "make", "remember", "do", "always", "never",
            "prefer", "implement", "add", "remove", "change", "update", "fix", "refactor",
            "optimize", "simplify", "standardize", "document", "test", "validate");

    private static final Pattern SENTENCE_SPLIT = Pattern.compile("[.!?]+");
    private static final int MIN_SENTENCE_LENGTH = 10;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * @return a candidate, or empty when the comment carries no recognizable rule
     */
    public Optional<RuleCandidate> extract(String commentText, CommentContext context) {
        if (commentText == null || commentText.isBlank()) {
            return Optional.empty();
        }

        for (RulePattern rulePattern : PATTERNS) {
            Matcher matcher = rulePattern.pattern().matcher(commentText);
            if (matcher.find()) {
                String ruleText = toRuleStatement(matcher.group());
                return Optional.of(buildCandidate(ruleText,
                        "Extracted using pattern matching: " + rulePattern.type(),
                        rulePattern.type(), context));
            }
        }

        for (String sentence : SENTENCE_SPLIT.split(commentText)) {
            String trimmed = sentence.trim();
            if (trimmed.length() > MIN_SENTENCE_LENGTH && startsWithImperative(trimmed)) {
                return Optional.of(buildCandidate(toRuleStatement(trimmed),
                        "Extracted from an imperative sentence", "imperative sentence", context));
            }
        }

        return Optional.empty();
    }

    /**
     * 0.5 base, +0.1 for rule text over 50 chars, +0.1 with code snippets,
     * +0.05 with a file path, +0.05 with a known author; capped at 1.0.
     */
    static double confidence(String ruleText, CommentContext context) {
        double confidence = 0.5;
        if (ruleText.length() > 50) {
            confidence += 0.1;
        }
        if (context != null) {
            if (context.hasCodeSnippets()) {
                confidence += 0.1;
            }
            if (context.hasFilePath()) {
                confidence += 0.05;
            }
            if (context.hasAuthor()) {
                confidence += 0.05;
            }
        }
        return roundScore(Math.min(confidence, 1.0));
    }

    static double roundScore(double score) {
        return Math.round(score * 100) / 100.0;
    }

    /**
     * Trims the match, capitalizes it and terminates it with a period.
     */
    static String toRuleStatement(String fragment) {
        String text = fragment.trim().replaceAll("[\\s,;:]+$", "");
        if (text.isEmpty()) {
            return text;
        }
        text = Character.toUpperCase(text.charAt(0)) + text.substring(1);
        return text.endsWith(".") ? text : text + ".";
    }

    private static boolean startsWithImperative(String sentence) {
        String firstWord = sentence.split("\\s+", 2)[0]
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z]", "");
        return IMPERATIVE_VERBS.contains(firstWord);
    }

    private static RuleCandidate buildCandidate(String ruleText, String explanation, String ruleType,
                                                CommentContext context) {
        ObjectNode raw = MAPPER.createObjectNode()
                .put("rule", ruleText)
                .put("rule_type", ruleType);

        return new RuleCandidate(
                ruleText,
                RuleCategory.classify(ruleText),
                RuleSeverity.assess(ruleText),
                confidence(ruleText, context),
                EXTRACTOR_ID,
                explanation,
                List.of(),
                List.of(),
                raw.toString());
    }

    private record RulePattern(String type, Pattern pattern) {
        RulePattern(String type, String regex) {
            this(type, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
    }
}
