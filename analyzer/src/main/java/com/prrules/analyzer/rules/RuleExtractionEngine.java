package com.prrules.analyzer.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a review comment into at most one {@link RuleCandidate}.
 *
 * <p>When a {@link RuleBackend} is configured it is asked first. A backend that
 * explicitly finds no rule ends the extraction. Any call, parse or validation
 * failure is logged and the comment goes through the {@link HeuristicRuleExtractor}
 * instead, so callers never see backend errors.</p>
 */
public class RuleExtractionEngine {

    private static final Logger logger = LoggerFactory.getLogger(RuleExtractionEngine.class);

    private static final Set<String> BONUS_CATEGORIES = Set.of("security", "performance", "critical");

    private final HeuristicRuleExtractor heuristic;
    private final RuleBackend backend;
    private final RulePromptBuilder promptBuilder;
    private final ObjectMapper objectMapper;

    /** Heuristic-only engine. */
    public RuleExtractionEngine() {
        this(null);
    }

    /**
     * @param backend external extractor, {@code null} for heuristic-only extraction
     */
    public RuleExtractionEngine(RuleBackend backend) {
        this(new HeuristicRuleExtractor(), backend, new RulePromptBuilder());
    }

    // Visible for testing
    RuleExtractionEngine(HeuristicRuleExtractor heuristic, RuleBackend backend, RulePromptBuilder promptBuilder) {
        this.heuristic = heuristic;
        this.backend = backend;
        this.promptBuilder = promptBuilder;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public boolean hasBackend() {
        return backend != null;
    }

    public Optional<RuleCandidate> extract(String commentText, CommentContext context) {
        if (commentText == null || commentText.isBlank()) {
            return Optional.empty();
        }

        if (backend != null) {
            try {
                return extractWithBackend(commentText, context);
            } catch (RuleBackendException e) {
                logger.warn("Rule backend {} failed, using heuristic extraction: {}",
                        backend.modelName(), e.getMessage());
            } catch (RuntimeException e) {
                logger.warn("Rule backend {} raised an unexpected error, using heuristic extraction",
                        backend.modelName(), e);
            }
        }

        return heuristic.extract(commentText, context);
    }

    private Optional<RuleCandidate> extractWithBackend(String commentText, CommentContext context)
            throws RuleBackendException {
        String raw = backend.complete(promptBuilder.systemPrompt(), promptBuilder.userPrompt(commentText, context));
        if (raw == null || raw.isBlank()) {
            logger.debug("Rule backend returned no content");
            return Optional.empty();
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(raw.trim());
        } catch (JsonProcessingException e) {
            throw new RuleBackendException("Rule backend answered with invalid JSON", false, e);
        }
        if (node == null || node.isNull()) {
            logger.debug("Rule backend found no rule");
            return Optional.empty();
        }
        if (!node.isObject()) {
            throw new RuleBackendException("Rule backend answered with a non-object: " + node.getNodeType(), false);
        }

        BackendRuleResponse response;
        try {
            response = objectMapper.treeToValue(node, BackendRuleResponse.class);
        } catch (JsonProcessingException e) {
            throw new RuleBackendException("Rule backend answer does not match the rule shape", false, e);
        }
        if (!response.hasRequiredFields()) {
            throw new RuleBackendException(
                    "Rule backend answer lacks rule_text, rule_category or rule_severity", false);
        }

        String ruleText = response.ruleText().trim();
        if (!ruleText.endsWith(".")) {
            ruleText += ".";
        }

        return Optional.of(new RuleCandidate(
                ruleText,
                RuleCategory.normalize(response.ruleCategory()),
                RuleSeverity.normalize(response.ruleSeverity()),
                modelConfidence(response, context),
                backend.modelName(),
                response.explanation(),
                response.examples(),
                response.relatedConcepts(),
                raw));
    }

    /**
     * 0.5 base, +0.1 for the three required fields, +0.05 each for an explanation,
     * examples, related concepts, rule text over 50 chars, a file path and a
     * security/performance/critical category; capped at 1.0.
     */
    static double modelConfidence(BackendRuleResponse response, CommentContext context) {
        double confidence = 0.5;
        if (response.hasRequiredFields()) {
            confidence += 0.1;
        }
        if (response.explanation() != null && !response.explanation().isBlank()) {
            confidence += 0.05;
        }
        if (notEmpty(response.examples())) {
            confidence += 0.05;
        }
        if (notEmpty(response.relatedConcepts())) {
            confidence += 0.05;
        }
        if (response.ruleText() != null && response.ruleText().length() > 50) {
            confidence += 0.05;
        }
        if (context != null && context.hasFilePath()) {
            confidence += 0.05;
        }
        if (response.ruleCategory() != null
                && BONUS_CATEGORIES.contains(response.ruleCategory().trim().toLowerCase(Locale.ROOT))) {
            confidence += 0.05;
        }
        return HeuristicRuleExtractor.roundScore(Math.min(confidence, 1.0));
    }

    private static boolean notEmpty(List<String> values) {
        return values != null && !values.isEmpty();
    }
}
