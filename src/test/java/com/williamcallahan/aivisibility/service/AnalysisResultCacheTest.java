package com.williamcallahan.aivisibility.service;

import static com.williamcallahan.aivisibility.domain.analysis.AnalysisFixtures.uniform;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class AnalysisResultCacheTest {

    @Test
    void storesLatestResultPerNormalizedUrl() {
        AnalysisResultCache cache = new AnalysisResultCache(ServiceTestSupport.fastProperties());

        cache.recordResult("https://Example.com/pricing/", uniform(40), 40);
        cache.recordResult("https://example.com/pricing", uniform(60), 60);

        AnalysisResultCache.CachedAnalysis cached = cache.lookup("HTTPS://EXAMPLE.COM/pricing").orElseThrow();
        assertEquals(60, cached.score());
        assertEquals(1, cache.size());
    }

    @Test
    void pathCaseIsSignificant() {
        assertNotEquals(AnalysisResultCache.normalizeUrl("https://example.com/About"),
                AnalysisResultCache.normalizeUrl("https://example.com/about"));
        assertEquals("https://example.com", AnalysisResultCache.normalizeUrl("https://EXAMPLE.com/"));
    }

    @Test
    void missingUrlIsEmpty() {
        AnalysisResultCache cache = new AnalysisResultCache(ServiceTestSupport.fastProperties());

        assertTrue(cache.lookup("https://example.com/").isEmpty());
    }
}
