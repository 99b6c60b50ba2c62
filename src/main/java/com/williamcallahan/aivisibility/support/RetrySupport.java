package com.williamcallahan.aivisibility.support;

import com.williamcallahan.aivisibility.domain.analysis.PageErrorType;
import java.time.Duration;

/**
 * Retry policy for page analysis attempts.
 *
 * <p>After each failed attempt the runner asks {@link #decide} what happens next: retry after a
 * linear backoff ({@code attemptNumber x baseDelay}) or give up. Non-transient failures and the
 * final attempt exhaust immediately.</p>
 */
public final class RetrySupport {

    private RetrySupport() {}

    /**
     * Next step after an attempt has failed.
     */
    public enum RetryDecision {
        /** Wait for {@link #backoffBefore} and try again. */
        RETRY,
        /** Stop and report the failure. */
        EXHAUSTED
    }

    /**
     * Decides whether a failed attempt is retried.
     *
     * @param failedAttempt 1-based number of the attempt that failed
     * @param maxAttempts total attempts allowed, at least 1
     * @param errorType classification of the failure
     * @return {@link RetryDecision#RETRY} while attempts remain for a transient failure
     */
    public static RetryDecision decide(int failedAttempt, int maxAttempts, PageErrorType errorType) {
        if (failedAttempt >= maxAttempts || !errorType.isTransient()) {
            return RetryDecision.EXHAUSTED;
        }
        return RetryDecision.RETRY;
    }

    /**
     * Linear backoff to wait after a failed attempt.
     *
     * @param failedAttempt 1-based number of the attempt that failed
     * @param baseDelay delay unit
     * @return {@code failedAttempt x baseDelay}
     */
    public static Duration backoffBefore(int failedAttempt, Duration baseDelay) {
        return baseDelay.multipliedBy(failedAttempt);
    }

    /**
     * Sleeps for a backoff interval.
     *
     * @param backoff time to wait
     * @throws InterruptedException when the waiting thread is interrupted
     */
    public static void pause(Duration backoff) throws InterruptedException {
        if (!backoff.isZero() && !backoff.isNegative()) {
            Thread.sleep(backoff.toMillis());
        }
    }
}
