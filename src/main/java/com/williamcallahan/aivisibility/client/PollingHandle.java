package com.williamcallahan.aivisibility.client;

import reactor.core.Disposable;

/**
 * Lets the caller detach a running poller. Stopping never cancels the server-side analysis.
 */
public final class PollingHandle {
    private final String sessionId;
    private final Disposable subscription;

    PollingHandle(String sessionId, Disposable subscription) {
        this.sessionId = sessionId;
        this.subscription = subscription;
    }

    public String sessionId() {
        return sessionId;
    }

    /**
     * Stops polling. Safe to call more than once.
     */
    public void stop() {
        subscription.dispose();
    }

    /**
     * Whether polling has ended, either by {@link #stop()} or by reaching a terminal snapshot.
     */
    public boolean isStopped() {
        return subscription.isDisposed();
    }
}
