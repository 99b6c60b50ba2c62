package com.williamcallahan.aivisibility.domain.analysis;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.ToIntFunction;

/**
 * Five category sub-scores produced for one analyzed page, each on a 0-100 scale.
 *
 * @param aiLlmVisibility how discoverable and citable the page is for AI/LLM crawlers
 * @param technical technical SEO health (HTTPS, mobile, bot access)
 * @param content content quality and structure
 * @param accessibility accessibility signals
 * @param authority authority and trust signals
 */
public record CategoryScores(int aiLlmVisibility, int technical, int content, int accessibility, int authority) {

    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 100;

    public CategoryScores {
        requireInRange(aiLlmVisibility, ScoreCategory.AI_LLM_VISIBILITY);
        requireInRange(technical, ScoreCategory.TECHNICAL);
        requireInRange(content, ScoreCategory.CONTENT);
        requireInRange(accessibility, ScoreCategory.ACCESSIBILITY);
        requireInRange(authority, ScoreCategory.AUTHORITY);
    }

    /**
     * Builds a score set by evaluating a function for every category.
     *
     * @param scoreForCategory supplies the sub-score for each category
     * @return populated score set
     */
    public static CategoryScores of(ToIntFunction<ScoreCategory> scoreForCategory) {
        return new CategoryScores(
                scoreForCategory.applyAsInt(ScoreCategory.AI_LLM_VISIBILITY),
                scoreForCategory.applyAsInt(ScoreCategory.TECHNICAL),
                scoreForCategory.applyAsInt(ScoreCategory.CONTENT),
                scoreForCategory.applyAsInt(ScoreCategory.ACCESSIBILITY),
                scoreForCategory.applyAsInt(ScoreCategory.AUTHORITY));
    }

    /**
     * Returns a score set with every category at zero.
     *
     * @return all-zero scores
     */
    public static CategoryScores zero() {
        return new CategoryScores(0, 0, 0, 0, 0);
    }

    /**
     * Reads one category's sub-score.
     *
     * @param category category to read
     * @return sub-score
     */
    public int get(ScoreCategory category) {
        return category.scoreOf(this);
    }

    /**
     * Computes the absolute per-category difference against another score set.
     *
     * @param other score set to compare against
     * @return absolute difference for every category, in declaration order
     */
    public Map<ScoreCategory, Integer> differenceFrom(CategoryScores other) {
        Map<ScoreCategory, Integer> differences = new EnumMap<>(ScoreCategory.class);
        for (ScoreCategory category : ScoreCategory.values()) {
            differences.put(category, Math.abs(get(category) - other.get(category)));
        }
        return differences;
    }

    private static void requireInRange(int score, ScoreCategory category) {
        if (score < MIN_SCORE || score > MAX_SCORE) {
            throw new IllegalArgumentException(
                    category + " score must be between " + MIN_SCORE + " and " + MAX_SCORE + " but was " + score);
        }
    }
}
