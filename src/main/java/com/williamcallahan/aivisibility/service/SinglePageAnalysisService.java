package com.williamcallahan.aivisibility.service;

import com.williamcallahan.aivisibility.config.AppProperties;
import com.williamcallahan.aivisibility.domain.analysis.PageErrorType;
import com.williamcallahan.aivisibility.domain.analysis.ScoreRecord;
import com.williamcallahan.aivisibility.domain.analysis.WeightedScore;
import com.williamcallahan.aivisibility.support.PageErrorClassifier;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Analyzes one URL synchronously, reusing a recent result when one is cached.
 */
@Service
public class SinglePageAnalysisService {
    private static final Logger log = LoggerFactory.getLogger(SinglePageAnalysisService.class);

    private final ConsistencyResolver consistencyResolver;
    private final AnalysisResultCache resultCache;
    private final Duration singlePageTimeout;

    public SinglePageAnalysisService(
            ConsistencyResolver consistencyResolver,
            AnalysisResultCache resultCache,
            AppProperties appProperties) {
        this.consistencyResolver = consistencyResolver;
        this.resultCache = resultCache;
        this.singlePageTimeout = appProperties.getAnalysis().getSinglePageTimeout();
    }

    /**
     * Outcome of a single-page analysis.
     *
     * @param url analyzed URL
     * @param analysis analyzer output
     * @param score weighted score
     * @param loadTimeMs analysis duration, 0 for cache hits
     * @param cached whether the result came from the cache
     */
    public record SinglePageAnalysis(String url, ScoreRecord analysis, int score, long loadTimeMs, boolean cached) {}

    /**
     * Returns a cached analysis or runs a fresh double-checked one.
     *
     * @param url absolute page URL
     * @param bypassCache skip the cache lookup
     * @return analysis result
     * @throws PageAnalysisException with a classified type when analysis fails
     */
    public SinglePageAnalysis analyze(String url, boolean bypassCache) {
        if (!bypassCache) {
            Optional<AnalysisResultCache.CachedAnalysis> cachedAnalysis = resultCache.lookup(url);
            if (cachedAnalysis.isPresent()) {
                log.info("Returning cached analysis for {}", url);
                AnalysisResultCache.CachedAnalysis hit = cachedAnalysis.get();
                return new SinglePageAnalysis(url, hit.analysis(), hit.score(), 0L, true);
            }
        }

        long startNanos = System.nanoTime();
        CompletableFuture<ScoreRecord> pending = consistencyResolver.analyzeAsync(url);
        ScoreRecord analysis;
        try {
            analysis = pending.get(singlePageTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException timeout) {
            pending.cancel(true);
            throw new PageAnalysisException(PageErrorType.TIMEOUT, PageErrorType.TIMEOUT.userMessage(), timeout);
        } catch (InterruptedException interrupted) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new PageAnalysisException(PageErrorType.OTHER, "Analysis interrupted", interrupted);
        } catch (ExecutionException failed) {
            Throwable cause = PageErrorClassifier.unwrap(failed);
            PageErrorType errorType = PageErrorClassifier.classify(cause);
            log.warn("Single-page analysis of {} failed [{}]: {}", url, errorType, cause.getMessage());
            throw new PageAnalysisException(errorType, PageErrorClassifier.userMessage(errorType, cause), cause);
        }

        long loadTimeMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        int score = WeightedScore.overall(analysis.scores());
        resultCache.recordResult(url, analysis, score);
        log.info("Analyzed {} with score {} in {}ms", url, score, loadTimeMs);
        return new SinglePageAnalysis(url, analysis, score, loadTimeMs, false);
    }
}
