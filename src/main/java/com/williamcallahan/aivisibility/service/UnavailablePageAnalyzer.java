package com.williamcallahan.aivisibility.service;

import com.williamcallahan.aivisibility.domain.analysis.PageErrorType;
import com.williamcallahan.aivisibility.domain.analysis.ScoreRecord;

/**
 * Stands in when no chat model is configured; every analysis fails.
 */
public class UnavailablePageAnalyzer implements PageAnalyzer {

    static final String UNAVAILABLE_MESSAGE = "AI analysis service unavailable - no chat model is configured";

    @Override
    public ScoreRecord analyze(String url) {
        throw new PageAnalysisException(PageErrorType.OTHER, UNAVAILABLE_MESSAGE, null);
    }
}
