package com.williamcallahan.aivisibility.domain.analysis;

/**
 * Lifecycle states of a multi-page analysis session.
 *
 * <p>{@link #ANALYZING} is the only non-terminal state. {@link #FAILED} means the orchestration
 * itself broke; individual page failures still end in {@link #COMPLETED}.</p>
 */
public enum SessionState {
    ANALYZING("analyzing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireValue;

    SessionState(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * Whether no further transition is possible.
     *
     * @return true for completed and failed
     */
    public boolean isTerminal() {
        return this != ANALYZING;
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
