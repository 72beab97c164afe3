package com.prrules.analyzer.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class RuleExtractionEngineTest {

    private static final String RULE_COMMENT = "You should always validate user input.";
    private static final CommentContext CONTEXT =
            new CommentContext("src/db/query.py", 12, "reviewer", "Add query layer", "octo/repo", true);

    private RuleBackend backend;
    private RuleExtractionEngine engine;

    @BeforeEach
    void setUp() {
        backend = mock(RuleBackend.class);
        when(backend.modelName()).thenReturn("gpt-test");
        engine = new RuleExtractionEngine(new HeuristicRuleExtractor(), backend, new RulePromptBuilder());
    }

    // =========================================================================
    // Backend answers
    // =========================================================================

    @Test
    @DisplayName("A complete backend answer becomes a normalized candidate")
    void extract_backendAnswer() throws Exception {
        String answer = """
                {
                  "rule_text": "Use parameterized queries",
                  "rule_category": "Security",
                  "rule_severity": "high",
                  "explanation": "Prevents SQL injection",
                  "examples": ["cursor.execute(sql, params)"],
                  "related_concepts": ["sql injection"]
                }""";
        when(backend.complete(anyString(), anyString())).thenReturn(answer);

        RuleCandidate rule = engine.extract(RULE_COMMENT, CONTEXT).orElseThrow();

        assertEquals("Use parameterized queries.", rule.ruleText());
        assertEquals(RuleCategory.SECURITY, rule.category());
        assertEquals(RuleSeverity.HIGH, rule.severity());
        assertEquals("gpt-test", rule.extractor());
        assertEquals(0.85, rule.confidence());
        assertEquals(1, rule.examples().size());
        assertEquals(answer, rule.rawOutput());
    }

    @Test
    @DisplayName("Prompt carries the comment and its context")
    void extract_promptContainsContext() throws Exception {
        when(backend.complete(anyString(), anyString())).thenReturn("null");

        engine.extract(RULE_COMMENT, CONTEXT);

        verify(backend).complete(eq(RulePromptBuilder.SYSTEM_PROMPT),
                argThat(prompt -> prompt.contains(RULE_COMMENT)
                        && prompt.contains("octo/repo")
                        && prompt.contains("src/db/query.py")
                        && prompt.contains("12")));
    }

    @Test
    @DisplayName("A JSON null answer means no rule and skips the heuristic")
    void extract_backendFindsNothing() throws Exception {
        when(backend.complete(anyString(), anyString())).thenReturn("null");

        assertTrue(engine.extract(RULE_COMMENT, CONTEXT).isEmpty());
    }

    @Test
    @DisplayName("An empty answer means no rule")
    void extract_backendEmpty() throws Exception {
        when(backend.complete(anyString(), anyString())).thenReturn("  ");

        assertTrue(engine.extract(RULE_COMMENT, CONTEXT).isEmpty());
    }

    // =========================================================================
    // Fallback to the heuristic tier
    // =========================================================================

    @Test
    @DisplayName("Backend failure falls back to heuristic extraction")
    void extract_backendFailure() throws Exception {
        when(backend.complete(anyString(), anyString()))
                .thenThrow(new RuleBackendException("HTTP 500", true));

        RuleCandidate rule = engine.extract(RULE_COMMENT, CONTEXT).orElseThrow();

        assertEquals(HeuristicRuleExtractor.EXTRACTOR_ID, rule.extractor());
        assertEquals("Should always validate user input.", rule.ruleText());
    }

    @Test
    @DisplayName("Malformed, non-object and incomplete answers fall back to heuristic extraction")
    void extract_unusableAnswers() throws Exception {
        when(backend.complete(anyString(), anyString()))
                .thenReturn("not json at all {")
                .thenReturn("[1, 2]")
                .thenReturn("{\"rule_text\": \"Only text\"}");

        for (int i = 0; i < 3; i++) {
            Optional<RuleCandidate> rule = engine.extract(RULE_COMMENT, CONTEXT);
            assertEquals(HeuristicRuleExtractor.EXTRACTOR_ID, rule.orElseThrow().extractor());
        }
    }

    @Test
    @DisplayName("Unexpected runtime errors from the backend do not escape")
    void extract_runtimeFailure() throws Exception {
        when(backend.complete(anyString(), anyString())).thenThrow(new IllegalStateException("boom"));

        assertTrue(engine.extract(RULE_COMMENT, CONTEXT).isPresent());
    }

    @Test
    @DisplayName("Blank comments never reach the backend")
    void extract_blankComment() {
        assertTrue(engine.extract("  ", CONTEXT).isEmpty());
        verifyNoInteractions(backend);
    }

    @Test
    @DisplayName("Engine without backend uses heuristic extraction only")
    void extract_withoutBackend() {
        RuleExtractionEngine heuristicOnly = new RuleExtractionEngine();

        assertFalse(heuristicOnly.hasBackend());
        assertEquals(HeuristicRuleExtractor.EXTRACTOR_ID,
                heuristicOnly.extract(RULE_COMMENT, CONTEXT).orElseThrow().extractor());
    }

    // =========================================================================
    // Model confidence
    // =========================================================================

    @Test
    @DisplayName("Model confidence sums the bonuses for a complete answer")
    void modelConfidence_allBonuses() {
        BackendRuleResponse full = new BackendRuleResponse(
                "x".repeat(60), "security", "critical", "why", List.of("e"), List.of("c"));

        assertEquals(0.9, RuleExtractionEngine.modelConfidence(full, CONTEXT));
        assertEquals(0.85, RuleExtractionEngine.modelConfidence(full, null));
    }

    @Test
    @DisplayName("Model confidence of a bare answer is the base plus the required-fields bonus")
    void modelConfidence_bare() {
        BackendRuleResponse bare = new BackendRuleResponse("Short", "style", "low", null, null, null);

        assertEquals(0.6, RuleExtractionEngine.modelConfidence(bare, null));
    }
}
