package com.prrules.analyzer.client;

import java.io.IOException;

/**
 * Raised when GitHub answers with a non-2xx status. Carries the status code and
 * the response body so callers can report what the API said.
 */
public class RequestFailedException extends IOException {

    private final int status;
    private final String body;

    public RequestFailedException(String url, int status, String body) {
        this(status, body, "GitHub API error: " + status + " for " + url);
    }

    protected RequestFailedException(int status, String body, String message) {
        super(message);
        this.status = status;
        this.body = body;
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }
}
