package com.williamcallahan.aivisibility.service;

import com.williamcallahan.aivisibility.config.AppProperties;
import com.williamcallahan.aivisibility.domain.analysis.SessionSnapshot;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * In-memory registry of analysis sessions keyed by session id.
 *
 * <p>Snapshots are immutable and replaced atomically per key. A terminal snapshot is never
 * replaced; it stays readable until the sweep removes it.</p>
 */
@Service
public class AnalysisSessionStore {
    private static final Logger log = LoggerFactory.getLogger(AnalysisSessionStore.class);

    private final ConcurrentMap<String, SessionSnapshot> sessionToSnapshot = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration sessionRetention;
    private final Duration sessionIdleTimeout;

    public AnalysisSessionStore(Clock clock, AppProperties appProperties) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sessionRetention = appProperties.getAnalysis().getSessionRetention();
        this.sessionIdleTimeout = appProperties.getAnalysis().getSessionIdleTimeout();
    }

    /**
     * Registers a new session.
     *
     * @param snapshot initial snapshot
     * @throws IllegalStateException when the id is already taken
     */
    public void create(SessionSnapshot snapshot) {
        SessionSnapshot previous = sessionToSnapshot.putIfAbsent(snapshot.sessionId(), snapshot);
        if (previous != null) {
            throw new IllegalStateException("Session " + snapshot.sessionId() + " already exists");
        }
    }

    public Optional<SessionSnapshot> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessionToSnapshot.get(sessionId));
    }

    /**
     * Applies a change to a live session and stamps the write time.
     *
     * @param sessionId session to change
     * @param change transformation of the current snapshot
     * @return the published snapshot, empty when the session is unknown
     */
    public Optional<SessionSnapshot> update(String sessionId, UnaryOperator<SessionSnapshot> change) {
        return Optional.ofNullable(sessionToSnapshot.computeIfPresent(sessionId, (id, current) -> {
            if (current.status().isTerminal()) {
                log.debug("Ignoring update to terminal session {}", id);
                return current;
            }
            return change.apply(current).touchedAt(clock.instant());
        }));
    }

    public void remove(String sessionId) {
        sessionToSnapshot.remove(sessionId);
    }

    public int size() {
        return sessionToSnapshot.size();
    }

    /**
     * Drops terminal sessions past their retention and analyzing sessions that stopped updating.
     *
     * @return number of sessions removed
     */
    @Scheduled(fixedDelayString = "${app.analysis.session-sweep-interval-ms:60000}")
    public int sweepExpiredSessions() {
        Instant now = clock.instant();
        int removed = 0;
        for (SessionSnapshot snapshot : sessionToSnapshot.values()) {
            if (isExpired(snapshot, now) && sessionToSnapshot.remove(snapshot.sessionId(), snapshot)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Swept {} expired analysis session(s), {} remaining", removed, sessionToSnapshot.size());
        }
        return removed;
    }

    private boolean isExpired(SessionSnapshot snapshot, Instant now) {
        if (snapshot.status().isTerminal()) {
            Instant completedAt = snapshot.completedAt() == null ? snapshot.updatedAt() : snapshot.completedAt();
            return !completedAt.plus(sessionRetention).isAfter(now);
        }
        return !snapshot.updatedAt().plus(sessionIdleTimeout).isAfter(now);
    }
}
