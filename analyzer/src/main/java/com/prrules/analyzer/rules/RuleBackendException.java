package com.prrules.analyzer.rules;

import java.io.IOException;

/**
 * A rule backend call failed or answered with something unusable.
 */
public class RuleBackendException extends IOException {

    private final boolean retryable;

    public RuleBackendException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public RuleBackendException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
