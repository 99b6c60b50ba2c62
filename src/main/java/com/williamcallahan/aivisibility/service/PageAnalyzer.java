package com.williamcallahan.aivisibility.service;

import com.williamcallahan.aivisibility.domain.analysis.ScoreRecord;

/**
 * Fetches and scores a single page.
 *
 * <p>Implementations are slow (seconds to minutes) and may fail; callers own timeouts and
 * retries. Calls may run concurrently for the same URL.</p>
 */
@FunctionalInterface
public interface PageAnalyzer {

    /**
     * Analyzes one page.
     *
     * @param url absolute page URL
     * @return structured score record
     * @throws PageAnalysisException or any other runtime exception when analysis fails
     */
    ScoreRecord analyze(String url);
}
