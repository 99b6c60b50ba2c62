package com.williamcallahan.aivisibility.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Analysis analysis = new Analysis();
    private Fetch fetch = new Fetch();
    private Poller poller = new Poller();

    public Analysis getAnalysis() {
        return analysis;
    }

    public void setAnalysis(Analysis analysis) {
        this.analysis = analysis;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Poller getPoller() {
        return poller;
    }

    public void setPoller(Poller poller) {
        this.poller = poller;
    }

    /**
     * Rejects settings the orchestration engine cannot run with.
     *
     * @throws IllegalArgumentException when a setting is out of range
     */
    @PostConstruct
    public void validateConfiguration() {
        requirePositive(analysis.getMaxPages(), "app.analysis.max-pages");
        requireNonNegative(analysis.getMaxRetries(), "app.analysis.max-retries");
        requirePositive(analysis.getPageAttemptTimeout(), "app.analysis.page-attempt-timeout");
        requirePositive(analysis.getSinglePageTimeout(), "app.analysis.single-page-timeout");
        requireNonNegative(analysis.getRetryBaseDelay(), "app.analysis.retry-base-delay");
        requireNonNegative(analysis.getVarianceThreshold(), "app.analysis.variance-threshold");
        requirePositive(analysis.getSessionRetention(), "app.analysis.session-retention");
        requirePositive(analysis.getSessionIdleTimeout(), "app.analysis.session-idle-timeout");
        requirePositive(analysis.getOrchestrationThreads(), "app.analysis.orchestration-threads");
        requireNonNegative(analysis.getOrchestrationQueueCapacity(), "app.analysis.orchestration-queue-capacity");
        requirePositive(analysis.getAnalysisThreads(), "app.analysis.analysis-threads");
        requirePositive(analysis.getResultCacheTtl(), "app.analysis.result-cache-ttl");
        requirePositive(analysis.getResultCacheMaxEntries(), "app.analysis.result-cache-max-entries");
        requirePositive(fetch.getTimeout(), "app.fetch.timeout");
        requirePositive(fetch.getMaxBodyBytes(), "app.fetch.max-body-bytes");
        requirePositive(fetch.getMaxContentChars(), "app.fetch.max-content-chars");
        requirePositive(poller.getInterval(), "app.poller.interval");
        if (analysis.getSinglePageTimeout().compareTo(analysis.getPageAttemptTimeout()) < 0) {
            throw new IllegalArgumentException(
                    "app.analysis.single-page-timeout must not be shorter than app.analysis.page-attempt-timeout");
        }
    }

    private static void requirePositive(long value, String propertyName) {
        if (value <= 0) {
            throw new IllegalArgumentException(propertyName + " must be positive but was " + value);
        }
    }

    private static void requireNonNegative(long value, String propertyName) {
        if (value < 0) {
            throw new IllegalArgumentException(propertyName + " must not be negative but was " + value);
        }
    }

    private static void requirePositive(Duration value, String propertyName) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(propertyName + " must be a positive duration but was " + value);
        }
    }

    private static void requireNonNegative(Duration value, String propertyName) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException(propertyName + " must not be negative but was " + value);
        }
    }

    public static class Analysis {
        private int maxPages = 5;
        private int maxRetries = 2;
        private Duration pageAttemptTimeout = Duration.ofMinutes(2);
        private Duration singlePageTimeout = Duration.ofMinutes(3);
        private Duration retryBaseDelay = Duration.ofSeconds(1);
        private int varianceThreshold = 10;
        private Duration sessionRetention = Duration.ofMinutes(30);
        private Duration sessionIdleTimeout = Duration.ofMinutes(30);
        private int orchestrationThreads = 4;
        private int orchestrationQueueCapacity = 20;
        private int analysisThreads = 8;
        private Duration resultCacheTtl = Duration.ofHours(24);
        private long resultCacheMaxEntries = 1_000;

        public int getMaxPages() { return maxPages; }
        public void setMaxPages(int maxPages) { this.maxPages = maxPages; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public Duration getPageAttemptTimeout() { return pageAttemptTimeout; }
        public void setPageAttemptTimeout(Duration pageAttemptTimeout) { this.pageAttemptTimeout = pageAttemptTimeout; }

        public Duration getSinglePageTimeout() { return singlePageTimeout; }
        public void setSinglePageTimeout(Duration singlePageTimeout) { this.singlePageTimeout = singlePageTimeout; }

        public Duration getRetryBaseDelay() { return retryBaseDelay; }
        public void setRetryBaseDelay(Duration retryBaseDelay) { this.retryBaseDelay = retryBaseDelay; }

        public int getVarianceThreshold() { return varianceThreshold; }
        public void setVarianceThreshold(int varianceThreshold) { this.varianceThreshold = varianceThreshold; }

        public Duration getSessionRetention() { return sessionRetention; }
        public void setSessionRetention(Duration sessionRetention) { this.sessionRetention = sessionRetention; }

        public Duration getSessionIdleTimeout() { return sessionIdleTimeout; }
        public void setSessionIdleTimeout(Duration sessionIdleTimeout) { this.sessionIdleTimeout = sessionIdleTimeout; }

        public int getOrchestrationThreads() { return orchestrationThreads; }
        public void setOrchestrationThreads(int orchestrationThreads) { this.orchestrationThreads = orchestrationThreads; }

        public int getOrchestrationQueueCapacity() { return orchestrationQueueCapacity; }
        public void setOrchestrationQueueCapacity(int orchestrationQueueCapacity) {
            this.orchestrationQueueCapacity = orchestrationQueueCapacity;
        }

        public int getAnalysisThreads() { return analysisThreads; }
        public void setAnalysisThreads(int analysisThreads) { this.analysisThreads = analysisThreads; }

        public Duration getResultCacheTtl() { return resultCacheTtl; }
        public void setResultCacheTtl(Duration resultCacheTtl) { this.resultCacheTtl = resultCacheTtl; }

        public long getResultCacheMaxEntries() { return resultCacheMaxEntries; }
        public void setResultCacheMaxEntries(long resultCacheMaxEntries) {
            this.resultCacheMaxEntries = resultCacheMaxEntries;
        }
    }

    public static class Fetch {
        private String userAgent = "Mozilla/5.0 (compatible; AIVisibilityAudit/1.0)";
        private Duration timeout = Duration.ofSeconds(30);
        private int maxBodyBytes = 2 * 1024 * 1024;
        private int maxContentChars = 20_000;

        public String getUserAgent() { return userAgent; }
        public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public int getMaxBodyBytes() { return maxBodyBytes; }
        public void setMaxBodyBytes(int maxBodyBytes) { this.maxBodyBytes = maxBodyBytes; }

        public int getMaxContentChars() { return maxContentChars; }
        public void setMaxContentChars(int maxContentChars) { this.maxContentChars = maxContentChars; }
    }

    public static class Poller {
        private String baseUrl = "http://localhost:8080";
        private Duration interval = Duration.ofSeconds(3);

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
    }
}
