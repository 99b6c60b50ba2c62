package com.williamcallahan.aivisibility.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Client view of a session snapshot. Page results and insights stay as raw JSON so the poller
 * keeps working when the server adds fields.
 *
 * @param sessionId session identifier
 * @param status "analyzing", "completed" or "failed"
 * @param currentPageIndex zero-based cursor
 * @param completedPageCount pages with a result
 * @param totalPages pages requested
 * @param currentStep progress phase
 * @param currentStepDetails progress detail
 * @param currentPageUrl page being analyzed
 * @param pageResults results so far
 * @param domainInsights aggregate when completed
 * @param error failure message when failed
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionProgress(
        String sessionId,
        String status,
        int currentPageIndex,
        int completedPageCount,
        int totalPages,
        String currentStep,
        String currentStepDetails,
        String currentPageUrl,
        List<JsonNode> pageResults,
        JsonNode domainInsights,
        String error) {

    static final String STATUS_COMPLETED = "completed";
    static final String STATUS_FAILED = "failed";

    public SessionProgress {
        pageResults = pageResults == null ? List.of() : List.copyOf(pageResults);
    }

    public boolean isTerminal() {
        return STATUS_COMPLETED.equals(status) || STATUS_FAILED.equals(status);
    }
}
