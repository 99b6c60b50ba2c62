package com.williamcallahan.aivisibility.domain.analysis;

/**
 * Fixed taxonomy of page-level analysis failures.
 *
 * <p>Page-level failures never fail a session; they become failing {@link PageResult}s carrying
 * the user-facing message of their type. {@link #OTHER} keeps the original failure message.</p>
 */
public enum PageErrorType {
    TIMEOUT("timeout", "Analysis timed out - website may be slow to respond", true),
    NETWORK(
            "network",
            "Network connection issue - please check your internet connection and try again with fewer pages",
            true),
    ACCESS_DENIED("access_denied", "Access denied - website may be blocking automated requests", false),
    NOT_FOUND("not_found", "Page not found - please check the URL", false),
    QUOTA("quota", "Service quota exceeded - please try again later", true),
    OTHER("other", "Analysis failed", true);

    private final String wireValue;
    private final String userMessage;
    private final boolean transientFailure;

    PageErrorType(String wireValue, String userMessage, boolean transientFailure) {
        this.wireValue = wireValue;
        this.userMessage = userMessage;
        this.transientFailure = transientFailure;
    }

    /**
     * Returns the message shown to users for this failure type.
     *
     * @return user-facing message
     */
    public String userMessage() {
        return userMessage;
    }

    /**
     * Whether another attempt could plausibly succeed.
     *
     * @return true for transient failures
     */
    public boolean isTransient() {
        return transientFailure;
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
