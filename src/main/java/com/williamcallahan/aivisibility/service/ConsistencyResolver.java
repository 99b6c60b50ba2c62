package com.williamcallahan.aivisibility.service;

import com.williamcallahan.aivisibility.config.AppProperties;
import com.williamcallahan.aivisibility.domain.analysis.CategoryScores;
import com.williamcallahan.aivisibility.domain.analysis.ScoreCategory;
import com.williamcallahan.aivisibility.domain.analysis.ScoreRecord;
import com.williamcallahan.aivisibility.domain.analysis.WeightedScore;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Runs every page analysis twice and reconciles divergent scores.
 *
 * <p>The analyzer is probabilistic, so the same page can score differently across calls. Both
 * runs execute concurrently on the analysis executor. When any category (or the analyzer's own
 * overall score) differs by more than the configured threshold, every score resolves to the
 * rounded mean of the two runs and the longer narrative is kept; otherwise the first run is
 * returned unchanged. The pair counts as a single attempt: if either run fails, the pair fails.</p>
 */
@Service
public class ConsistencyResolver {
    private static final Logger log = LoggerFactory.getLogger(ConsistencyResolver.class);

    static final String OVERALL_KEY = "overall";
    private static final int CATEGORY_REPORT_THRESHOLD = 8;

    private final PageAnalyzer pageAnalyzer;
    private final AsyncTaskExecutor analysisExecutor;
    private final int varianceThreshold;

    /**
     * Creates the resolver.
     *
     * @param pageAnalyzer analyzer invoked twice per page
     * @param analysisExecutor executor for the two concurrent runs
     * @param appProperties source of the variance threshold
     */
    public ConsistencyResolver(
            PageAnalyzer pageAnalyzer,
            @Qualifier("analysisExecutor") AsyncTaskExecutor analysisExecutor,
            AppProperties appProperties) {
        this.pageAnalyzer = Objects.requireNonNull(pageAnalyzer, "pageAnalyzer");
        this.analysisExecutor = Objects.requireNonNull(analysisExecutor, "analysisExecutor");
        this.varianceThreshold = appProperties.getAnalysis().getVarianceThreshold();
    }

    /**
     * Starts both analyzer runs and returns the reconciled result.
     *
     * <p>Cancelling the returned future, or a failure of either run, interrupts whichever run is
     * still executing so its analysis thread is released for the next attempt.</p>
     *
     * @param url page to analyze
     * @return future completing with the resolved record, or exceptionally with the first failure
     */
    public CompletableFuture<ScoreRecord> analyzeAsync(String url) {
        CompletableFuture<ScoreRecord> firstRun = new CompletableFuture<>();
        CompletableFuture<ScoreRecord> secondRun = new CompletableFuture<>();
        Future<?> firstTask = submitRun(url, firstRun);
        Future<?> secondTask;
        try {
            secondTask = submitRun(url, secondRun);
        } catch (RuntimeException rejected) {
            firstTask.cancel(true);
            throw rejected;
        }

        CompletableFuture<ScoreRecord> resolved = firstRun.thenCombine(
                secondRun, (firstRecord, secondRecord) -> resolve(url, firstRecord, secondRecord).result());

        // fail the pair as soon as one run fails
        firstRun.whenComplete((ignored, failure) -> failFast(resolved, failure));
        secondRun.whenComplete((ignored, failure) -> failFast(resolved, failure));
        resolved.whenComplete((ignored, failure) -> {
            if (failure != null) {
                interruptIfRunning(firstRun, firstTask);
                interruptIfRunning(secondRun, secondTask);
            }
        });
        return resolved;
    }

    private Future<?> submitRun(String url, CompletableFuture<ScoreRecord> run) {
        return analysisExecutor.submit(() -> {
            try {
                run.complete(pageAnalyzer.analyze(url));
            } catch (RuntimeException | Error failure) {
                run.completeExceptionally(failure);
            }
        });
    }

    // A finished run is never interrupted: its thread may still be running completion callbacks
    private static void interruptIfRunning(CompletableFuture<ScoreRecord> run, Future<?> task) {
        if (!run.isDone()) {
            task.cancel(true);
        }
    }

    /**
     * Reconciles two analyzer runs of the same page.
     *
     * @param url analyzed page, for logging
     * @param firstRecord result of the first run
     * @param secondRecord result of the second run
     * @return resolution outcome with the per-score differences
     */
    public ConsistencyOutcome resolve(String url, ScoreRecord firstRecord, ScoreRecord secondRecord) {
        Objects.requireNonNull(firstRecord, "firstRecord");
        Objects.requireNonNull(secondRecord, "secondRecord");

        Map<String, Integer> differences = new LinkedHashMap<>();
        differences.put(OVERALL_KEY, Math.abs(firstRecord.overallScore() - secondRecord.overallScore()));
        firstRecord.scores().differenceFrom(secondRecord.scores())
                .forEach((category, difference) -> differences.put(category.toString(), difference));
        int maxVariance = Collections.max(differences.values());

        if (maxVariance <= varianceThreshold) {
            log.info("Score consistency verified for {} - max variance {} points", url, maxVariance);
            return new ConsistencyOutcome(firstRecord, maxVariance, false, differences);
        }

        log.warn("Score variance detected for {} - max variance {} points, using mediated scores", url, maxVariance);
        differences.forEach((scoreName, difference) -> {
            if (difference > CATEGORY_REPORT_THRESHOLD) {
                log.warn("  {}: {} point variance", scoreName, difference);
            }
        });

        CategoryScores firstScores = firstRecord.scores();
        CategoryScores secondScores = secondRecord.scores();
        CategoryScores mediatedScores = CategoryScores.of(
                category -> WeightedScore.roundedMean(firstScores.get(category), secondScores.get(category)));
        int mediatedOverall = WeightedScore.roundedMean(firstRecord.overallScore(), secondRecord.overallScore());
        // equal lengths keep the second run's narrative
        String narrative = firstRecord.narrativeReport().length() > secondRecord.narrativeReport().length()
                ? firstRecord.narrativeReport()
                : secondRecord.narrativeReport();

        ScoreRecord mediated = firstRecord.withResolvedScores(mediatedOverall, mediatedScores, narrative);
        return new ConsistencyOutcome(mediated, maxVariance, true, differences);
    }

    private static void failFast(CompletableFuture<ScoreRecord> resolved, Throwable failure) {
        if (failure != null) {
            resolved.completeExceptionally(failure);
        }
    }

    /**
     * Result of reconciling two runs.
     *
     * @param result record to use for the page
     * @param maxVariance largest absolute difference across the overall score and every category
     * @param highVariance whether the scores were mediated
     * @param differences absolute difference per score name ({@code overall} plus each {@link ScoreCategory})
     */
    public record ConsistencyOutcome(
            ScoreRecord result, int maxVariance, boolean highVariance, Map<String, Integer> differences) {
        public ConsistencyOutcome {
            Objects.requireNonNull(result, "result");
            differences = Collections.unmodifiableMap(new LinkedHashMap<>(differences));
        }
    }
}
