package com.williamcallahan.aivisibility.domain.analysis;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Structured result of analyzing one page.
 *
 * <p>{@code overallScore} is the analyzer's own suggestion and is kept for comparison only;
 * the score a page is ranked by is always recomputed from {@code scores} with
 * {@link WeightedScore#overall(CategoryScores)}.</p>
 *
 * @param overallScore analyzer-suggested overall score (0-100)
 * @param scores category sub-scores
 * @param narrativeReport free-text narrative explaining the scores
 * @param recommendations improvement suggestions, most important first
 * @param analyzedAt when the analysis finished
 */
public record ScoreRecord(
        int overallScore,
        CategoryScores scores,
        String narrativeReport,
        List<String> recommendations,
        Instant analyzedAt) {

    public ScoreRecord {
        if (overallScore < CategoryScores.MIN_SCORE || overallScore > CategoryScores.MAX_SCORE) {
            throw new IllegalArgumentException("overallScore must be between 0 and 100 but was " + overallScore);
        }
        Objects.requireNonNull(scores, "scores");
        narrativeReport = narrativeReport == null ? "" : narrativeReport;
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        Objects.requireNonNull(analyzedAt, "analyzedAt");
    }

    /**
     * Returns a copy with different scores and narrative, keeping the remaining fields.
     *
     * @param resolvedOverall overall score to report
     * @param resolvedScores category scores to report
     * @param resolvedNarrative narrative to report
     * @return adjusted copy
     */
    public ScoreRecord withResolvedScores(int resolvedOverall, CategoryScores resolvedScores, String resolvedNarrative) {
        return new ScoreRecord(resolvedOverall, resolvedScores, resolvedNarrative, recommendations, analyzedAt);
    }
}
