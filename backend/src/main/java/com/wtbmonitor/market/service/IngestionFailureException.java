package com.wtbmonitor.market.service;

/**
 * Storage fault while appending observations or completing a session. The session never becomes complete.
 */
public class IngestionFailureException extends RuntimeException {
    private final String sessionId;

    public IngestionFailureException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public IngestionFailureException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
