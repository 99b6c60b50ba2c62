package com.williamcallahan.aivisibility.service;

import com.williamcallahan.aivisibility.domain.analysis.ScoreRecord;

/**
 * Receives every successfully analyzed page for retrieval outside the orchestration engine.
 */
@FunctionalInterface
public interface AnalysisResultRecorder {

    /**
     * Records a fresh analysis.
     *
     * @param url analyzed URL
     * @param analysis analyzer output after consistency resolution
     * @param score weighted overall score
     */
    void recordResult(String url, ScoreRecord analysis, int score);
}
