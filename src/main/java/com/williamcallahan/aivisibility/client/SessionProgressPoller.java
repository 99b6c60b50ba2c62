package com.williamcallahan.aivisibility.client;

import com.williamcallahan.aivisibility.config.AppProperties;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * HTTP client for multi-page analysis sessions.
 *
 * <p>{@link #poll} reads the session snapshot on a fixed interval until the session is
 * {@code completed} or {@code failed}; the terminal snapshot is the last element emitted. Reads are
 * idempotent, so a poll that fails (I/O error, 5xx) is logged and skipped and the next tick tries
 * again. A 404 ends the stream with {@link SessionNotFoundException}.</p>
 */
@Component
public class SessionProgressPoller {
    private static final Logger log = LoggerFactory.getLogger(SessionProgressPoller.class);

    private static final String START_PATH = "/api/analyze-multi-page";
    private static final String SNAPSHOT_PATH = "/api/analyze-multi-page/{sessionId}";

    private final WebClient webClient;
    private final Duration pollInterval;

    @Autowired
    public SessionProgressPoller(WebClient.Builder webClientBuilder, AppProperties appProperties) {
        this(webClientBuilder.clone().baseUrl(appProperties.getPoller().getBaseUrl()).build(),
                appProperties.getPoller().getInterval());
    }

    public SessionProgressPoller(WebClient webClient, Duration pollInterval) {
        this.webClient = Objects.requireNonNull(webClient, "webClient");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    }

    /**
     * Starts a multi-page analysis.
     *
     * @param domain site root URL
     * @param paths page paths in order
     * @return server acknowledgement with the session id
     */
    public Mono<SessionStart> start(String domain, List<String> paths) {
        return webClient.post()
                .uri(START_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("domain", domain, "paths", paths))
                .retrieve()
                .bodyToMono(SessionStart.class)
                .doOnNext(started -> log.info("Started session {} for {} ({} page(s))",
                        started.sessionId(), domain, started.totalPages()));
    }

    /**
     * Polls a session until it reaches a terminal state.
     *
     * @param sessionId session to follow
     * @return snapshots, ending with the terminal one
     */
    public Flux<SessionProgress> poll(String sessionId) {
        return Flux.interval(Duration.ZERO, pollInterval)
                .onBackpressureDrop()
                .concatMap(tick -> fetchSnapshot(sessionId)
                        .onErrorResume(failure -> !(failure instanceof SessionNotFoundException), failure -> {
                            log.warn("Poll for session {} failed, retrying next tick: {}", sessionId, failure.getMessage());
                            return Mono.empty();
                        }), 1)
                .takeUntil(SessionProgress::isTerminal);
    }

    /**
     * Polls in the background and pushes each snapshot to the listener.
     *
     * @param sessionId session to follow
     * @param onProgress receives every snapshot
     * @param onError receives a terminal polling error such as {@link SessionNotFoundException}
     * @return handle that detaches the poller
     */
    public PollingHandle watch(String sessionId, Consumer<SessionProgress> onProgress, Consumer<Throwable> onError) {
        return new PollingHandle(sessionId, poll(sessionId).subscribe(onProgress, onError));
    }

    /**
     * Blocks until the session is terminal.
     *
     * @param sessionId session to follow
     * @param maxWait upper bound on the wait
     * @return the terminal snapshot
     * @throws SessionNotFoundException when the session is unknown to the server
     * @throws IllegalStateException when {@code maxWait} elapses first
     */
    public SessionProgress awaitTerminal(String sessionId, Duration maxWait) {
        return poll(sessionId).last().block(maxWait);
    }

    Mono<SessionProgress> fetchSnapshot(String sessionId) {
        return webClient.get()
                .uri(SNAPSHOT_PATH, sessionId)
                .retrieve()
                .onStatus(status -> status.value() == HttpStatus.NOT_FOUND.value(),
                        response -> Mono.error(new SessionNotFoundException(sessionId)))
                .bodyToMono(SessionProgress.class);
    }
}
