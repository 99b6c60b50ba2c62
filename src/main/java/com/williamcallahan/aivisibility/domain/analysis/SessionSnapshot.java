package com.williamcallahan.aivisibility.domain.analysis;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable view of a multi-page analysis session at one point in time.
 *
 * <p>The owning orchestrator publishes a new snapshot for every change, so readers always see
 * a consistent state. While {@link SessionState#ANALYZING} neither {@code domainInsights} nor
 * {@code error} is set; a terminal snapshot carries exactly one of them and is never replaced.</p>
 *
 * @param sessionId opaque lookup key
 * @param domain root site being audited
 * @param pageList requested paths in analysis order
 * @param pageUrls full URLs derived from domain and paths, same order
 * @param status lifecycle state
 * @param currentPageIndex zero-based cursor into {@code pageList}
 * @param completedPageCount pages that reached a success or failure result
 * @param totalPages size of {@code pageList}
 * @param pageResults results so far, in page order
 * @param currentStep short progress phase
 * @param currentStepDetails progress detail line
 * @param currentPageUrl URL being analyzed
 * @param startedAt session creation time
 * @param updatedAt time of the latest write
 * @param completedAt time the session became terminal
 * @param domainInsights aggregate, only when completed
 * @param error orchestration failure, only when failed
 */
public record SessionSnapshot(
        String sessionId,
        String domain,
        List<String> pageList,
        List<String> pageUrls,
        SessionState status,
        int currentPageIndex,
        int completedPageCount,
        int totalPages,
        List<PageResult> pageResults,
        String currentStep,
        String currentStepDetails,
        String currentPageUrl,
        Instant startedAt,
        Instant updatedAt,
        Instant completedAt,
        DomainInsights domainInsights,
        String error) {

    public SessionSnapshot {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(domain, "domain");
        pageList = List.copyOf(pageList);
        pageUrls = List.copyOf(pageUrls);
        pageResults = List.copyOf(pageResults);
        Objects.requireNonNull(status, "status");
        if (pageList.size() != pageUrls.size()) {
            throw new IllegalArgumentException("pageList and pageUrls must have the same size");
        }
        if (status == SessionState.ANALYZING && (domainInsights != null || error != null)) {
            throw new IllegalArgumentException("An analyzing session has neither insights nor error");
        }
        if (status == SessionState.COMPLETED && (domainInsights == null || error != null)) {
            throw new IllegalArgumentException("A completed session carries insights and no error");
        }
        if (status == SessionState.FAILED && (error == null || domainInsights != null)) {
            throw new IllegalArgumentException("A failed session carries an error and no insights");
        }
    }

    /**
     * Creates the initial snapshot of a freshly accepted session.
     *
     * @param sessionId opaque lookup key
     * @param domain root site
     * @param pageList requested paths
     * @param pageUrls full URLs
     * @param now creation time
     * @return analyzing snapshot positioned on the first page
     */
    public static SessionSnapshot started(
            String sessionId, String domain, List<String> pageList, List<String> pageUrls, Instant now) {
        return new SessionSnapshot(
                sessionId,
                domain,
                pageList,
                pageUrls,
                SessionState.ANALYZING,
                0,
                0,
                pageList.size(),
                List.of(),
                "Queued",
                "Waiting to analyze " + pageList.size() + " page(s)",
                pageUrls.isEmpty() ? null : pageUrls.get(0),
                now,
                now,
                null,
                null,
                null);
    }

    /**
     * Moves the cursor to a page and replaces the progress hints.
     *
     * @param pageIndex page about to be analyzed
     * @param step progress phase
     * @param details progress detail
     * @return updated snapshot
     */
    public SessionSnapshot atPage(int pageIndex, String step, String details) {
        requireAnalyzing();
        if (pageIndex < currentPageIndex || pageIndex >= totalPages) {
            throw new IllegalArgumentException("Page cursor cannot move from " + currentPageIndex + " to " + pageIndex);
        }
        return new SessionSnapshot(sessionId, domain, pageList, pageUrls, status, pageIndex, completedPageCount,
                totalPages, pageResults, step, details, pageUrls.get(pageIndex), startedAt, updatedAt, completedAt,
                domainInsights, error);
    }

    /**
     * Replaces the progress hints without moving the cursor.
     *
     * @param step progress phase
     * @param details progress detail
     * @return updated snapshot
     */
    public SessionSnapshot withStep(String step, String details) {
        requireAnalyzing();
        return new SessionSnapshot(sessionId, domain, pageList, pageUrls, status, currentPageIndex,
                completedPageCount, totalPages, pageResults, step, details, currentPageUrl, startedAt, updatedAt,
                completedAt, domainInsights, error);
    }

    /**
     * Appends the next page result and counts the page as done.
     *
     * @param pageResult result for the page at index {@code pageResults().size()}
     * @return updated snapshot
     */
    public SessionSnapshot withPageResult(PageResult pageResult) {
        requireAnalyzing();
        Objects.requireNonNull(pageResult, "pageResult");
        if (pageResults.size() >= totalPages) {
            throw new IllegalStateException("All " + totalPages + " page results are already recorded");
        }
        List<PageResult> appended = new ArrayList<>(pageResults);
        appended.add(pageResult);
        return new SessionSnapshot(sessionId, domain, pageList, pageUrls, status, currentPageIndex,
                appended.size(), totalPages, appended, currentStep, currentStepDetails, currentPageUrl, startedAt,
                updatedAt, completedAt, domainInsights, error);
    }

    /**
     * Transitions to {@link SessionState#COMPLETED}.
     *
     * @param insights aggregate over all page results
     * @param now completion time
     * @return terminal snapshot
     */
    public SessionSnapshot completed(DomainInsights insights, Instant now) {
        requireAnalyzing();
        if (pageResults.size() != totalPages) {
            throw new IllegalStateException(
                    "Cannot complete with " + pageResults.size() + " of " + totalPages + " page results");
        }
        return new SessionSnapshot(sessionId, domain, pageList, pageUrls, SessionState.COMPLETED, currentPageIndex,
                completedPageCount, totalPages, pageResults, "Completed",
                "Analyzed " + insights.completedPages() + " of " + totalPages + " page(s)", currentPageUrl,
                startedAt, now, now, insights, null);
    }

    /**
     * Transitions to {@link SessionState#FAILED}, keeping any partial results.
     *
     * @param failureMessage orchestration failure description
     * @param now failure time
     * @return terminal snapshot
     */
    public SessionSnapshot failed(String failureMessage, Instant now) {
        requireAnalyzing();
        String message = failureMessage == null || failureMessage.isBlank() ? "Unknown error" : failureMessage;
        return new SessionSnapshot(sessionId, domain, pageList, pageUrls, SessionState.FAILED, currentPageIndex,
                completedPageCount, totalPages, pageResults, "Failed", message, currentPageUrl, startedAt, now, now,
                null, message);
    }

    /**
     * Stamps the time of the latest write.
     *
     * @param now write time
     * @return updated snapshot
     */
    public SessionSnapshot touchedAt(Instant now) {
        return new SessionSnapshot(sessionId, domain, pageList, pageUrls, status, currentPageIndex,
                completedPageCount, totalPages, pageResults, currentStep, currentStepDetails, currentPageUrl,
                startedAt, now, completedAt, domainInsights, error);
    }

    private void requireAnalyzing() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Session " + sessionId + " is already " + status);
        }
    }
}
