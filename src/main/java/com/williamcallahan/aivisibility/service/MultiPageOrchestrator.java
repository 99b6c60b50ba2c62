package com.williamcallahan.aivisibility.service;

import com.williamcallahan.aivisibility.config.AppProperties;
import com.williamcallahan.aivisibility.domain.analysis.DomainInsights;
import com.williamcallahan.aivisibility.domain.analysis.PageResult;
import com.williamcallahan.aivisibility.domain.analysis.SessionSnapshot;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Drives multi-page analysis sessions.
 *
 * <p>{@link #startSession} validates the request, registers the session and hands the run to the
 * orchestration executor, returning before any page is analyzed. The run walks the page list in
 * order; each page is analyzed by {@link PageJobRunner}, whose failures become page results rather
 * than session failures. Only an exception escaping the page envelope fails the session.</p>
 */
@Service
public class MultiPageOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(MultiPageOrchestrator.class);

    private final AnalysisSessionStore sessionStore;
    private final PageJobRunner pageJobRunner;
    private final TaskExecutor orchestrationExecutor;
    private final Clock clock;
    private final int maxPages;

    /**
     * Creates the orchestrator.
     *
     * @param sessionStore shared session registry
     * @param pageJobRunner per-page retry envelope
     * @param orchestrationExecutor executor running one task per session
     * @param clock time source for snapshot timestamps
     * @param appProperties page-count limit
     */
    public MultiPageOrchestrator(
            AnalysisSessionStore sessionStore,
            PageJobRunner pageJobRunner,
            @Qualifier("orchestrationExecutor") TaskExecutor orchestrationExecutor,
            Clock clock,
            AppProperties appProperties) {
        this.sessionStore = Objects.requireNonNull(sessionStore, "sessionStore");
        this.pageJobRunner = Objects.requireNonNull(pageJobRunner, "pageJobRunner");
        this.orchestrationExecutor = Objects.requireNonNull(orchestrationExecutor, "orchestrationExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxPages = appProperties.getAnalysis().getMaxPages();
    }

    /**
     * Identifies an accepted session.
     *
     * @param sessionId lookup key for polling
     * @param totalPages number of pages queued
     */
    public record StartedSession(String sessionId, int totalPages) {}

    /**
     * Accepts a session and starts analyzing it in the background.
     *
     * @param domain absolute http(s) URL of the site
     * @param pageList paths to analyze, in order
     * @return the new session id and page count
     * @throws IllegalArgumentException when the request is invalid; nothing is started
     * @throws AnalysisCapacityException when no orchestration capacity is left
     */
    public StartedSession startSession(String domain, List<String> pageList) {
        String normalizedDomain = validateDomain(domain);
        List<String> paths = validatePages(pageList);
        List<String> pageUrls = new ArrayList<>(paths.size());
        for (String path : paths) {
            pageUrls.add(buildPageUrl(normalizedDomain, path));
        }

        String sessionId = UUID.randomUUID().toString();
        sessionStore.create(SessionSnapshot.started(sessionId, normalizedDomain, paths, pageUrls, clock.instant()));
        try {
            orchestrationExecutor.execute(() -> runSession(sessionId));
        } catch (RejectedExecutionException rejected) {
            sessionStore.remove(sessionId);
            log.warn("Rejected analysis session for {}: orchestration executor is saturated", normalizedDomain);
            throw new AnalysisCapacityException(
                    "Too many analyses in progress - please try again shortly", rejected);
        }
        log.info("Started analysis session {} for {} ({} page(s))", sessionId, normalizedDomain, paths.size());
        return new StartedSession(sessionId, paths.size());
    }

    public Optional<SessionSnapshot> getSnapshot(String sessionId) {
        return sessionStore.get(sessionId);
    }

    void runSession(String sessionId) {
        SessionSnapshot initial = sessionStore.get(sessionId).orElse(null);
        if (initial == null) {
            log.warn("Session {} disappeared before its run started", sessionId);
            return;
        }
        try {
            int totalPages = initial.totalPages();
            for (int pageIndex = 0; pageIndex < totalPages; pageIndex++) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new IllegalStateException("Analysis interrupted");
                }
                String path = initial.pageList().get(pageIndex);
                String url = initial.pageUrls().get(pageIndex);
                int cursor = pageIndex;
                sessionStore.update(sessionId, snapshot -> snapshot.atPage(cursor, "Starting analysis",
                        "Beginning analysis of page " + (cursor + 1) + "/" + totalPages));

                PageResult pageResult = pageJobRunner.run(url, path,
                        (step, details) -> sessionStore.update(sessionId, snapshot -> snapshot.withStep(step, details)));
                sessionStore.update(sessionId, snapshot -> snapshot.withPageResult(pageResult));
            }

            SessionSnapshot finished = sessionStore.get(sessionId)
                    .orElseThrow(() -> new IllegalStateException("Session " + sessionId + " expired while running"));
            DomainInsights insights = DomainInsights.aggregate(finished.pageResults());
            sessionStore.update(sessionId, snapshot -> snapshot.completed(insights, clock.instant()));
            log.info("Completed analysis session {}: {}/{} page(s) succeeded, average score {}",
                    sessionId, insights.completedPages(), insights.totalPages(), insights.averageScore());
        } catch (RuntimeException orchestrationFailure) {
            log.error("Analysis session {} failed", sessionId, orchestrationFailure);
            sessionStore.update(sessionId, snapshot -> snapshot.failed(orchestrationFailure.getMessage(), clock.instant()));
        }
    }

    private static String validateDomain(String domain) {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("Domain is required");
        }
        String trimmed = domain.trim();
        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException invalidUri) {
            throw new IllegalArgumentException("Invalid domain URL: " + trimmed, invalidUri);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!("http".equals(scheme) || "https".equals(scheme)) || uri.getHost() == null) {
            throw new IllegalArgumentException("Domain must be an absolute http or https URL: " + trimmed);
        }
        return trimmed;
    }

    private List<String> validatePages(List<String> pageList) {
        if (pageList == null || pageList.isEmpty()) {
            throw new IllegalArgumentException("At least one page path is required");
        }
        if (pageList.size() > maxPages) {
            throw new IllegalArgumentException(
                    "Too many pages: " + pageList.size() + " requested, at most " + maxPages + " allowed");
        }
        List<String> paths = new ArrayList<>(pageList.size());
        for (String path : pageList) {
            if (path == null || path.isBlank()) {
                throw new IllegalArgumentException("Page paths must not be blank");
            }
            paths.add(path.trim());
        }
        return List.copyOf(paths);
    }

    static String buildPageUrl(String domain, String path) {
        String base = domain.endsWith("/") ? domain.substring(0, domain.length() - 1) : domain;
        return base + (path.startsWith("/") ? path : "/" + path);
    }
}
