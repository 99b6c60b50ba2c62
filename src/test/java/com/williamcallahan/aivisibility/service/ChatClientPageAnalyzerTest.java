package com.williamcallahan.aivisibility.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import com.williamcallahan.aivisibility.domain.analysis.PageErrorType;
import com.williamcallahan.aivisibility.domain.analysis.ScoreRecord;
import com.williamcallahan.aivisibility.support.PageErrorClassifier;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;

class ChatClientPageAnalyzerTest {
    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private ChatClientPageAnalyzer analyzer;
    private HttpServer server;

    @BeforeEach
    void setUp() {
        analyzer = new ChatClientPageAnalyzer(mock(ChatClient.class), new ObjectMapper(),
                ServiceTestSupport.fastProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    @DisplayName("Parses a fenced JSON reply with prioritized recommendations")
    void parsesReply() {
        String reply = """
                ```json
                {"overallScore": 68.6, "aiLlmVisibilityScore": 80, "techScore": 60, "contentScore": 70,
                 "accessibilityScore": 90, "authorityScore": 50,
                 "recommendations": {"high": ["Add FAQ schema", " "], "low": ["Compress images"]},
                 "narrativeReport": "Overall Score of 69/100", "redFlags": []}
                ```""";

        ScoreRecord parsed = analyzer.parseReply("https://example.com/", reply);

        assertEquals(69, parsed.overallScore());
        assertEquals(80, parsed.scores().aiLlmVisibility());
        assertEquals(50, parsed.scores().authority());
        assertEquals(List.of("Add FAQ schema", "Compress images"), parsed.recommendations());
        assertEquals("Overall Score of 69/100", parsed.narrativeReport());
        assertEquals(NOW, parsed.analyzedAt());
    }

    @Test
    void rejectsMissingOrOutOfRangeScores() {
        assertThrows(PageAnalysisException.class,
                () -> analyzer.parseReply("https://example.com/", "{\"overallScore\": 50}"));
        assertThrows(PageAnalysisException.class, () -> analyzer.parseReply("https://example.com/",
                "{\"overallScore\": 50, \"aiLlmVisibilityScore\": 150, \"techScore\": 1, \"contentScore\": 1,"
                        + " \"accessibilityScore\": 1, \"authorityScore\": 1}"));
        assertThrows(PageAnalysisException.class, () -> analyzer.parseReply("https://example.com/", "not json"));
    }

    @Test
    void promptSummarizesPage() {
        Document page = Jsoup.parse("<html><head><title>Pricing</title>"
                + "<meta name=\"description\" content=\"Plans and prices\"></head>"
                + "<body><h1>Plans</h1><p>Starter and Pro.</p><img src=\"a.png\"></body></html>");

        String prompt = analyzer.buildPrompt("https://example.com/pricing", page);

        assertTrue(prompt.contains("Title: Pricing"));
        assertTrue(prompt.contains("Meta description: Plans and prices"));
        assertTrue(prompt.contains("- h1: Plans"));
        assertTrue(prompt.contains("Images without alt text: 1"));
        assertTrue(prompt.contains("Starter and Pro."));
    }

    @Test
    @DisplayName("HTTP errors from the site carry their status for classification")
    void fetchFailureCarriesStatus() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/blocked", exchange -> {
            byte[] body = "nope".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(403, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
        String url = "http://127.0.0.1:" + server.getAddress().getPort() + "/blocked";

        PageAnalysisException failure = assertThrows(PageAnalysisException.class, () -> analyzer.fetch(url));

        assertEquals(403, failure.httpStatus().getAsInt());
        assertEquals(PageErrorType.ACCESS_DENIED, PageErrorClassifier.classify(failure));
    }

    @Test
    void unavailableAnalyzerFailsWithItsMessage() {
        PageAnalysisException failure = assertThrows(PageAnalysisException.class,
                () -> new UnavailablePageAnalyzer().analyze("https://example.com/"));

        assertEquals(PageErrorType.OTHER, failure.errorType());
        assertEquals(UnavailablePageAnalyzer.UNAVAILABLE_MESSAGE,
                PageErrorClassifier.userMessage(failure.errorType(), failure));
    }
}
