package com.williamcallahan.aivisibility.domain.analysis;

/**
 * Derives overall scores from category sub-scores and rounds aggregate values.
 *
 * <p>Every overall page score in the system comes from {@link #overall(CategoryScores)} so a
 * page scores identically in single-page and multi-page mode. Rounding is half-up on the exact
 * rational value; the weighted sum is accumulated in integer hundredths, so
 * {@code (80, 60, 70, 90, 50)} yields exactly 68.5 and rounds to 69.</p>
 */
public final class WeightedScore {

    private static final int PERCENT = 100;

    private WeightedScore() {}

    /**
     * Computes {@code round(v*0.25 + t*0.20 + c*0.25 + a*0.10 + au*0.20)}.
     *
     * @param scores category sub-scores
     * @return overall score between 0 and 100
     */
    public static int overall(CategoryScores scores) {
        long weightedHundredths = 0;
        for (ScoreCategory category : ScoreCategory.values()) {
            weightedHundredths += (long) scores.get(category) * category.weightPercent();
        }
        return roundHalfUp(weightedHundredths, PERCENT);
    }

    /**
     * Rounded arithmetic mean of two scores.
     *
     * @param first first score
     * @param second second score
     * @return {@code round((first + second) / 2)}
     */
    public static int roundedMean(int first, int second) {
        return roundHalfUp((long) first + second, 2);
    }

    /**
     * Rounds {@code numerator / denominator} half-up for non-negative operands.
     *
     * @param numerator non-negative dividend
     * @param denominator positive divisor
     * @return rounded quotient
     */
    public static int roundHalfUp(long numerator, long denominator) {
        if (denominator <= 0) {
            throw new IllegalArgumentException("denominator must be positive");
        }
        if (numerator < 0) {
            throw new IllegalArgumentException("numerator must not be negative");
        }
        return Math.toIntExact((numerator * 2 + denominator) / (denominator * 2));
    }
}
