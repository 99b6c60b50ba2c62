package com.williamcallahan.aivisibility.service;

import com.williamcallahan.aivisibility.config.AppProperties;
import com.williamcallahan.aivisibility.domain.analysis.PageErrorType;
import com.williamcallahan.aivisibility.domain.analysis.PageResult;
import com.williamcallahan.aivisibility.domain.analysis.ScoreRecord;
import com.williamcallahan.aivisibility.domain.analysis.WeightedScore;
import com.williamcallahan.aivisibility.support.PageErrorClassifier;
import com.williamcallahan.aivisibility.support.RetrySupport;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Analyzes one page with a per-attempt deadline, bounded retries and error classification.
 *
 * <p>{@link #run} never throws: every outcome is reported as a {@link PageResult}. Progress is
 * pushed to the supplied {@link ProgressListener} as the attempt moves through its phases.</p>
 */
@Service
public class PageJobRunner {
    private static final Logger log = LoggerFactory.getLogger(PageJobRunner.class);

    static final String STEP_PREPARING = "Preparing analysis";
    static final String STEP_ANALYZING = "Analyzing website";
    static final String STEP_RETRYING = "Retrying analysis";
    static final String STEP_FINALIZING = "Finalizing results";

    private final ConsistencyResolver consistencyResolver;
    private final AnalysisResultRecorder resultRecorder;
    private final int maxAttempts;
    private final Duration attemptTimeout;
    private final Duration retryBaseDelay;

    /**
     * Creates the runner.
     *
     * @param consistencyResolver double-checked analysis of one page
     * @param resultRecorder sink for fresh results
     * @param appProperties retry and timeout settings
     */
    public PageJobRunner(
            ConsistencyResolver consistencyResolver,
            AnalysisResultRecorder resultRecorder,
            AppProperties appProperties) {
        this.consistencyResolver = Objects.requireNonNull(consistencyResolver, "consistencyResolver");
        this.resultRecorder = Objects.requireNonNull(resultRecorder, "resultRecorder");
        AppProperties.Analysis analysis = appProperties.getAnalysis();
        this.maxAttempts = analysis.getMaxRetries() + 1;
        this.attemptTimeout = analysis.getPageAttemptTimeout();
        this.retryBaseDelay = analysis.getRetryBaseDelay();
    }

    /**
     * Receives progress hints while a page is analyzed.
     */
    @FunctionalInterface
    public interface ProgressListener {
        /**
         * Called when the attempt enters a new phase.
         *
         * @param step short phase name
         * @param details human-readable detail
         */
        void onStep(String step, String details);
    }

    /**
     * Analyzes a page until it succeeds, fails permanently or runs out of attempts.
     *
     * @param url full page URL
     * @param path requested path, echoed in the result
     * @param progressListener receiver of progress hints
     * @return success or failure result, never null
     */
    public PageResult run(String url, String path, ProgressListener progressListener) {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(progressListener, "progressListener");
        progressListener.onStep(STEP_PREPARING, "Preparing to analyze " + url);

        int attempt = 0;
        while (true) {
            attempt++;
            progressListener.onStep(STEP_ANALYZING,
                    "Scraping content and analyzing with AI (attempt " + attempt + "/" + maxAttempts + ")");
            long attemptStart = System.nanoTime();
            try {
                ScoreRecord analysis = awaitAttempt(url);
                long loadTimeMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - attemptStart);
                int score = WeightedScore.overall(analysis.scores());
                progressListener.onStep(STEP_FINALIZING, "Saving analysis results (Score: " + score + ")");
                recordQuietly(url, analysis, score);
                log.info("Analyzed {} on attempt {} with score {} in {}ms", url, attempt, score, loadTimeMs);
                return PageResult.succeeded(url, path, analysis, score, loadTimeMs, attempt);
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
                log.warn("Analysis of {} interrupted on attempt {}", url, attempt);
                return PageResult.failed(url, path, PageErrorType.OTHER, "Analysis interrupted", attempt);
            } catch (RuntimeException | ExecutionException | TimeoutException failure) {
                Throwable cause = PageErrorClassifier.unwrap(failure);
                PageErrorType errorType = PageErrorClassifier.classify(cause);
                RetrySupport.RetryDecision decision = RetrySupport.decide(attempt, maxAttempts, errorType);
                if (decision == RetrySupport.RetryDecision.EXHAUSTED) {
                    String message = PageErrorClassifier.userMessage(errorType, cause);
                    log.warn("Analysis of {} failed after {} attempt(s) [{}]: {}",
                            url, attempt, errorType, cause.getMessage());
                    return PageResult.failed(url, path, errorType, message, attempt);
                }

                Duration backoff = RetrySupport.backoffBefore(attempt, retryBaseDelay);
                log.info("Attempt {}/{} for {} failed [{}], retrying in {}ms",
                        attempt, maxAttempts, url, errorType, backoff.toMillis());
                progressListener.onStep(STEP_RETRYING,
                        "Attempt " + attempt + " failed (" + errorType + "), retrying in "
                                + backoff.toSeconds() + "s");
                try {
                    RetrySupport.pause(backoff);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    log.warn("Retry backoff for {} interrupted after attempt {}", url, attempt);
                    return PageResult.failed(url, path, PageErrorType.OTHER, "Analysis interrupted", attempt);
                }
            }
        }
    }

    private ScoreRecord awaitAttempt(String url)
            throws InterruptedException, ExecutionException, TimeoutException {
        CompletableFuture<ScoreRecord> pending = consistencyResolver.analyzeAsync(url);
        try {
            return pending.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException timeout) {
            pending.cancel(true);
            throw new TimeoutException("Page analysis timeout after " + attemptTimeout.toSeconds()
                    + "s - moving to next page");
        } catch (InterruptedException interrupted) {
            pending.cancel(true);
            throw interrupted;
        }
    }

    private void recordQuietly(String url, ScoreRecord analysis, int score) {
        try {
            resultRecorder.recordResult(url, analysis, score);
        } catch (RuntimeException recordingFailure) {
            log.warn("Failed to record analysis result for {}: {}", url, recordingFailure.getMessage());
        }
    }
}
