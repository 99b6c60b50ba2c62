package com.williamcallahan.aivisibility.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.aivisibility.config.AppProperties;
import com.williamcallahan.aivisibility.domain.analysis.ScoreRecord;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Keeps the most recent successful analysis per URL for single-page lookups.
 *
 * <p>Multi-page sessions write here through {@link AnalysisResultRecorder} but never read.</p>
 */
@Service
public class AnalysisResultCache implements AnalysisResultRecorder {
    private static final Logger log = LoggerFactory.getLogger(AnalysisResultCache.class);

    private final Cache<String, CachedAnalysis> resultCache;

    public AnalysisResultCache(AppProperties appProperties) {
        AppProperties.Analysis analysis = appProperties.getAnalysis();
        this.resultCache = Caffeine.newBuilder()
                .maximumSize(analysis.getResultCacheMaxEntries())
                .expireAfterWrite(analysis.getResultCacheTtl())
                .recordStats()
                .build();
    }

    /**
     * A cached analysis with the score computed when it was stored.
     *
     * @param url URL as originally analyzed
     * @param analysis analyzer output
     * @param score weighted score
     */
    public record CachedAnalysis(String url, ScoreRecord analysis, int score) {}

    @Override
    public void recordResult(String url, ScoreRecord analysis, int score) {
        resultCache.put(normalizeUrl(url), new CachedAnalysis(url, analysis, score));
        log.debug("Cached analysis for {} (score {})", url, score);
    }

    public Optional<CachedAnalysis> lookup(String url) {
        return Optional.ofNullable(resultCache.getIfPresent(normalizeUrl(url)));
    }

    public long size() {
        resultCache.cleanUp();
        return resultCache.estimatedSize();
    }

    // Scheme and host are case-insensitive; a single trailing slash is ignored
    static String normalizeUrl(String url) {
        String trimmed = url.trim();
        int schemeEnd = trimmed.indexOf("://");
        if (schemeEnd > 0) {
            int pathStart = trimmed.indexOf('/', schemeEnd + 3);
            String authority = pathStart < 0 ? trimmed : trimmed.substring(0, pathStart);
            String rest = pathStart < 0 ? "" : trimmed.substring(pathStart);
            trimmed = authority.toLowerCase(Locale.ROOT) + rest;
        }
        if (trimmed.endsWith("/") && trimmed.length() > 1) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
