package com.williamcallahan.aivisibility.domain.analysis;

import java.util.List;
import java.util.Objects;

/**
 * Domain-wide aggregate over every page of a completed session.
 *
 * @param totalPages number of pages in the session
 * @param completedPages number of successfully analyzed pages
 * @param averageScore rounded mean of successful scores, zero when none succeeded
 * @param bestPage highest scoring result, earliest page on ties
 * @param worstPage lowest scoring result, earliest page on ties (a failed page scores zero)
 * @param successRate rounded percentage of successfully analyzed pages
 * @param categoryAverages rounded per-category mean over successful pages
 */
public record DomainInsights(
        int totalPages,
        int completedPages,
        int averageScore,
        PageResult bestPage,
        PageResult worstPage,
        int successRate,
        CategoryScores categoryAverages) {

    public DomainInsights {
        Objects.requireNonNull(bestPage, "bestPage");
        Objects.requireNonNull(worstPage, "worstPage");
        Objects.requireNonNull(categoryAverages, "categoryAverages");
    }

    /**
     * Aggregates page results in page order.
     *
     * <p>Best and worst are reduced over all results, not only successes, so a failed page can
     * be reported as the worst page. The first occurrence wins ties.</p>
     *
     * @param pageResults results in page order, never empty
     * @return aggregate insights
     */
    public static DomainInsights aggregate(List<PageResult> pageResults) {
        Objects.requireNonNull(pageResults, "pageResults");
        if (pageResults.isEmpty()) {
            throw new IllegalArgumentException("Cannot aggregate insights without page results");
        }

        int totalPages = pageResults.size();
        int completedPages = 0;
        long successfulScoreSum = 0;
        long[] categorySums = new long[ScoreCategory.values().length];
        PageResult bestPage = pageResults.get(0);
        PageResult worstPage = pageResults.get(0);

        for (PageResult pageResult : pageResults) {
            if (pageResult.hasAnalysis()) {
                completedPages++;
                successfulScoreSum += pageResult.score();
                CategoryScores pageScores = pageResult.analysis().scores();
                for (ScoreCategory category : ScoreCategory.values()) {
                    categorySums[category.ordinal()] += pageScores.get(category);
                }
            }
            if (pageResult.score() > bestPage.score()) {
                bestPage = pageResult;
            }
            if (pageResult.score() < worstPage.score()) {
                worstPage = pageResult;
            }
        }

        int averageScore = completedPages > 0 ? WeightedScore.roundHalfUp(successfulScoreSum, completedPages) : 0;
        int successRate = WeightedScore.roundHalfUp(100L * completedPages, totalPages);
        CategoryScores categoryAverages = completedPages > 0
                ? averageCategories(categorySums, completedPages)
                : CategoryScores.zero();

        return new DomainInsights(
                totalPages, completedPages, averageScore, bestPage, worstPage, successRate, categoryAverages);
    }

    private static CategoryScores averageCategories(long[] categorySums, int completedPages) {
        return CategoryScores.of(category -> WeightedScore.roundHalfUp(categorySums[category.ordinal()], completedPages));
    }
}
