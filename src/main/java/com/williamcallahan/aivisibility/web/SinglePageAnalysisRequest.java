package com.williamcallahan.aivisibility.web;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for a single-page analysis.
 *
 * @param url absolute http(s) URL to analyze
 * @param bypassCache skip a cached result when true
 */
public record SinglePageAnalysisRequest(@NotBlank String url, Boolean bypassCache) {

    /**
     * Returns whether the cache should be skipped, treating a missing flag as false.
     */
    public boolean shouldBypassCache() {
        return Boolean.TRUE.equals(bypassCache);
    }
}
