package com.williamcallahan.aivisibility.domain.analysis;

import java.util.function.ToIntFunction;

/**
 * The five scored categories of an AI/LLM visibility audit and their fixed weights.
 *
 * <p>Weights are expressed in whole percent and sum to 100 so the weighted overall score can be
 * computed exactly in integer hundredths.</p>
 */
public enum ScoreCategory {
    AI_LLM_VISIBILITY("aiLlmVisibility", 25, CategoryScores::aiLlmVisibility),
    TECHNICAL("technical", 20, CategoryScores::technical),
    CONTENT("content", 25, CategoryScores::content),
    ACCESSIBILITY("accessibility", 10, CategoryScores::accessibility),
    AUTHORITY("authority", 20, CategoryScores::authority);

    private final String label;
    private final int weightPercent;
    private final ToIntFunction<CategoryScores> extractor;

    ScoreCategory(String label, int weightPercent, ToIntFunction<CategoryScores> extractor) {
        this.label = label;
        this.weightPercent = weightPercent;
        this.extractor = extractor;
    }

    /**
     * Returns the weight of this category in whole percent.
     *
     * @return weight between 0 and 100
     */
    public int weightPercent() {
        return weightPercent;
    }

    /**
     * Reads this category's sub-score from a score set.
     *
     * @param scores category scores to read
     * @return sub-score on the 0-100 scale
     */
    public int scoreOf(CategoryScores scores) {
        return extractor.applyAsInt(scores);
    }

    @Override
    public String toString() {
        return label;
    }
}
