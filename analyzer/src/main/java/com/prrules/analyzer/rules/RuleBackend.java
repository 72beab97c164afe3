package com.prrules.analyzer.rules;

/**
 * Thin seam over an external model that turns a prompt into a JSON rule object.
 */
public interface RuleBackend {

    /** Identifier recorded as the extractor of rules this backend produces. */
    String modelName();

    /**
     * @return the model's raw answer, {@code null} or blank when it had nothing to say
     * @throws RuleBackendException when the call fails after the backend's own retries
     */
    String complete(String systemPrompt, String userPrompt) throws RuleBackendException;
}
