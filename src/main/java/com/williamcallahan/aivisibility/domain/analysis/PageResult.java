package com.williamcallahan.aivisibility.domain.analysis;

import java.util.Objects;

/**
 * Outcome for one page of a multi-page session.
 *
 * <p>Exactly one branch is populated: a success carries {@code analysis}, {@code score} and
 * {@code loadTimeMs}; a failure carries {@code error} and {@code errorType} and always scores
 * zero. Orchestrated results are never served from cache.</p>
 *
 * @param url full URL that was analyzed
 * @param path path as requested
 * @param analysis analyzer output on success, otherwise null
 * @param score weighted score on success, zero on failure
 * @param loadTimeMs duration of the successful attempt, otherwise null
 * @param error classified failure message, otherwise null
 * @param errorType failure classification, otherwise null
 * @param attempts number of attempts made for this page
 * @param cached whether the result came from the result cache
 */
public record PageResult(
        String url,
        String path,
        ScoreRecord analysis,
        int score,
        Long loadTimeMs,
        String error,
        PageErrorType errorType,
        int attempts,
        boolean cached) {

    public PageResult {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(path, "path");
        if (analysis != null) {
            if (error != null || errorType != null) {
                throw new IllegalArgumentException("A successful page result cannot carry an error");
            }
            Objects.requireNonNull(loadTimeMs, "loadTimeMs");
            if (score < CategoryScores.MIN_SCORE || score > CategoryScores.MAX_SCORE) {
                throw new IllegalArgumentException("score must be between 0 and 100 but was " + score);
            }
        } else {
            Objects.requireNonNull(error, "error");
            Objects.requireNonNull(errorType, "errorType");
            if (score != 0) {
                throw new IllegalArgumentException("A failed page result must score 0");
            }
            if (loadTimeMs != null) {
                throw new IllegalArgumentException("A failed page result has no load time");
            }
        }
    }

    /**
     * Creates a successful, freshly analyzed result.
     *
     * @param url full URL
     * @param path requested path
     * @param analysis analyzer output
     * @param score weighted score
     * @param loadTimeMs duration of the successful attempt
     * @param attempts attempts used
     * @return successful page result
     */
    public static PageResult succeeded(
            String url, String path, ScoreRecord analysis, int score, long loadTimeMs, int attempts) {
        return new PageResult(url, path, analysis, score, loadTimeMs, null, null, attempts, false);
    }

    /**
     * Creates a failed result scoring zero.
     *
     * @param url full URL
     * @param path requested path
     * @param errorType failure classification
     * @param error classified message
     * @param attempts attempts used
     * @return failed page result
     */
    public static PageResult failed(String url, String path, PageErrorType errorType, String error, int attempts) {
        return new PageResult(url, path, null, 0, null, error, errorType, attempts, false);
    }

    /**
     * Whether this page was analyzed successfully.
     *
     * @return true on the success branch
     */
    public boolean hasAnalysis() {
        return analysis != null;
    }
}
