package com.williamcallahan.aivisibility.client;

/**
 * Raised when the server no longer knows a polled session (unknown id or swept after expiry).
 */
public class SessionNotFoundException extends RuntimeException {
    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found or expired: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
