package com.williamcallahan.aivisibility.client;

import static org.junit.jupiter.api.Assertions.*;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

class SessionProgressPollerTest {
    private static final Duration POLL_INTERVAL = Duration.ofMillis(20);

    private HttpServer server;
    private SessionProgressPoller poller;
    private final ConcurrentLinkedQueue<String> requestBodies = new ConcurrentLinkedQueue<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
        WebClient webClient = WebClient.builder()
                .baseUrl("http://127.0.0.1:" + server.getAddress().getPort())
                .build();
        poller = new SessionProgressPoller(webClient, POLL_INTERVAL);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private static void respond(HttpExchange exchange, int status, String json) throws IOException {
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    private static String snapshotJson(String status, int completed) {
        return "{\"sessionId\":\"s-1\",\"status\":\"" + status + "\",\"currentPageIndex\":" + completed
                + ",\"completedPageCount\":" + completed + ",\"totalPages\":2,\"currentStep\":\"Analyzing website\","
                + "\"pageResults\":[],\"unknownField\":true}";
    }

    @Test
    @DisplayName("Start posts the domain and paths")
    void startsSession() {
        server.createContext("/api/analyze-multi-page", exchange -> {
            requestBodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, 200, "{\"sessionId\":\"s-1\",\"status\":\"started\","
                    + "\"message\":\"Multi-page analysis started successfully\",\"totalPages\":2}");
        });

        StepVerifier.create(poller.start("https://example.com", List.of("/", "/about")))
                .assertNext(started -> {
                    assertEquals("s-1", started.sessionId());
                    assertEquals(2, started.totalPages());
                })
                .verifyComplete();

        String body = requestBodies.poll();
        assertNotNull(body);
        assertTrue(body.contains("\"domain\":\"https://example.com\""));
        assertTrue(body.contains("\"paths\":[\"/\",\"/about\"]"));
    }

    @Test
    @DisplayName("Polling stops after the terminal snapshot and skips failed polls")
    void pollsUntilTerminal() {
        AtomicInteger calls = new AtomicInteger();
        server.createContext("/api/analyze-multi-page/s-1", exchange -> {
            int call = calls.incrementAndGet();
            if (call == 1) {
                respond(exchange, 200, snapshotJson("analyzing", 0));
            } else if (call == 2) {
                respond(exchange, 500, "{\"status\":\"error\",\"message\":\"boom\"}");
            } else if (call == 3) {
                respond(exchange, 200, snapshotJson("analyzing", 1));
            } else {
                respond(exchange, 200, snapshotJson("completed", 2));
            }
        });

        StepVerifier.create(poller.poll("s-1"))
                .assertNext(progress -> assertEquals(0, progress.completedPageCount()))
                .assertNext(progress -> assertEquals(1, progress.completedPageCount()))
                .assertNext(progress -> {
                    assertTrue(progress.isTerminal());
                    assertEquals("completed", progress.status());
                })
                .expectComplete()
                .verify(Duration.ofSeconds(10));
        assertEquals(4, calls.get());
    }

    @Test
    @DisplayName("An unknown session ends the stream with not found")
    void unknownSessionEndsStream() {
        server.createContext("/api/analyze-multi-page/missing", exchange ->
                respond(exchange, 404, "{\"status\":\"error\",\"message\":\"Session not found or expired\"}"));

        StepVerifier.create(poller.poll("missing"))
                .expectErrorSatisfies(failure -> {
                    assertInstanceOf(SessionNotFoundException.class, failure);
                    assertEquals("missing", ((SessionNotFoundException) failure).getSessionId());
                })
                .verify(Duration.ofSeconds(10));
    }

    @Test
    @DisplayName("Stopping a watch only detaches the client")
    void stopDetachesPoller() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        server.createContext("/api/analyze-multi-page/s-1", exchange -> {
            calls.incrementAndGet();
            respond(exchange, 200, snapshotJson("analyzing", 0));
        });
        List<SessionProgress> received = new CopyOnWriteArrayList<>();

        PollingHandle handle = poller.watch("s-1", received::add, failure -> fail(failure));
        long deadline = System.currentTimeMillis() + 5000;
        while (received.isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        handle.stop();
        int callsAtStop = calls.get();
        Thread.sleep(POLL_INTERVAL.toMillis() * 5);

        assertTrue(handle.isStopped());
        assertFalse(received.isEmpty());
        assertTrue(calls.get() <= callsAtStop + 1, "no further polls after stop");
    }

    @Test
    void awaitTerminalReturnsFailedSnapshot() {
        server.createContext("/api/analyze-multi-page/s-1", exchange ->
                respond(exchange, 200, "{\"sessionId\":\"s-1\",\"status\":\"failed\",\"error\":\"boom\"}"));

        SessionProgress terminal = poller.awaitTerminal("s-1", Duration.ofSeconds(5));

        assertEquals("failed", terminal.status());
        assertEquals("boom", terminal.error());
        assertTrue(terminal.pageResults().isEmpty());
    }
}
