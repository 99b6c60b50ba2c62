package com.williamcallahan.aivisibility.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.aivisibility.config.AppProperties;
import com.williamcallahan.aivisibility.domain.analysis.CategoryScores;
import com.williamcallahan.aivisibility.domain.analysis.ScoreCategory;
import com.williamcallahan.aivisibility.domain.analysis.ScoreRecord;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Scores a page by fetching it with jsoup and asking the chat model for a structured audit.
 */
public class ChatClientPageAnalyzer implements PageAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ChatClientPageAnalyzer.class);

    private static final int MAX_HEADINGS = 25;
    private static final List<String> RECOMMENDATION_PRIORITIES = List.of("high", "medium", "low");

    private final ChatClient chatClient;
    private final ObjectMapper objectMapper;
    private final AppProperties.Fetch fetchSettings;
    private final Clock clock;

    public ChatClientPageAnalyzer(
            ChatClient chatClient, ObjectMapper objectMapper, AppProperties appProperties, Clock clock) {
        this.chatClient = chatClient;
        this.objectMapper = objectMapper;
        this.fetchSettings = appProperties.getFetch();
        this.clock = clock;
    }

    @Override
    public ScoreRecord analyze(String url) {
        Document page = fetch(url);
        if (Thread.currentThread().isInterrupted()) {
            throw new PageAnalysisException("Analysis of " + url + " interrupted before the model call");
        }
        String prompt = buildPrompt(url, page);
        String reply = chatClient.prompt().user(prompt).call().content();
        return parseReply(url, reply);
    }

    Document fetch(String url) {
        try {
            return Jsoup.connect(url)
                    .userAgent(fetchSettings.getUserAgent())
                    .timeout((int) fetchSettings.getTimeout().toMillis())
                    .maxBodySize(fetchSettings.getMaxBodyBytes())
                    .followRedirects(true)
                    .get();
        } catch (HttpStatusException statusException) {
            throw new PageAnalysisException("Failed to fetch " + url + ": HTTP " + statusException.getStatusCode(),
                    statusException, statusException.getStatusCode());
        } catch (IOException ioException) {
            throw new PageAnalysisException("Failed to fetch " + url + ": " + ioException.getMessage(), ioException);
        }
    }

    String buildPrompt(String url, Document page) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Audit this web page for visibility to AI assistants and large language models.\n");
        prompt.append("URL: ").append(url).append("\n");
        prompt.append("HTTPS: ").append(url.startsWith("https://")).append("\n");
        prompt.append("Title: ").append(page.title()).append("\n");
        prompt.append("Meta description: ").append(page.select("meta[name=description]").attr("content")).append("\n");
        prompt.append("Robots meta: ").append(page.select("meta[name=robots]").attr("content")).append("\n");
        prompt.append("Viewport meta present: ").append(!page.select("meta[name=viewport]").isEmpty()).append("\n");
        prompt.append("JSON-LD blocks: ").append(page.select("script[type=application/ld+json]").size()).append("\n");
        prompt.append("Images without alt text: ").append(page.select("img:not([alt])").size()).append("\n");
        prompt.append("Headings:\n");
        int headingCount = 0;
        for (Element heading : page.select("h1, h2, h3")) {
            if (headingCount++ >= MAX_HEADINGS) {
                break;
            }
            prompt.append("- ").append(heading.tagName()).append(": ").append(heading.text()).append("\n");
        }
        String bodyText = page.body() == null ? "" : page.body().text();
        if (bodyText.length() > fetchSettings.getMaxContentChars()) {
            bodyText = bodyText.substring(0, fetchSettings.getMaxContentChars());
        }
        prompt.append("\nVisible text:\n").append(bodyText).append("\n");

        prompt.append("\nScore each category from 0 to 100:\n");
        prompt.append("- aiLlmVisibilityScore (25%): crawler access, robots directives, structured data\n");
        prompt.append("- techScore (20%): HTTPS, performance signals, mobile readiness, rendering\n");
        prompt.append("- contentScore (25%): FAQ and Q&A structure, quotable, well organized content\n");
        prompt.append("- accessibilityScore (10%): responsive layout, alt text, readability\n");
        prompt.append("- authorityScore (20%): author attribution, credentials, trust signals\n");
        prompt.append("\nRespond as JSON with these fields:\n");
        prompt.append("- overallScore: weighted total using the percentages above\n");
        prompt.append("- aiLlmVisibilityScore, techScore, contentScore, accessibilityScore, authorityScore\n");
        prompt.append("- recommendations: object with high[], medium[] and low[] arrays of actionable items\n");
        prompt.append("- narrativeReport: professional audit narrative that quotes the same overallScore\n");
        return prompt.toString();
    }

    ScoreRecord parseReply(String url, String reply) {
        JsonNode root;
        try {
            root = objectMapper.reader()
                    .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .readTree(cleanJson(reply));
        } catch (JsonProcessingException parseFailure) {
            throw new PageAnalysisException("Invalid analysis response for " + url + ": " + parseFailure.getOriginalMessage(),
                    parseFailure);
        }
        if (root == null || !root.isObject()) {
            throw new PageAnalysisException("Invalid analysis response for " + url + ": expected a JSON object");
        }

        CategoryScores scores = CategoryScores.of(category -> requireScore(url, root, replyField(category)));
        int overallScore = requireScore(url, root, "overallScore");
        String narrative = root.path("narrativeReport").asText("");
        List<String> recommendations = readRecommendations(root.path("recommendations"));
        log.debug("Parsed analysis for {} with {} recommendation(s)", url, recommendations.size());
        return new ScoreRecord(overallScore, scores, narrative, recommendations, clock.instant());
    }

    static String replyField(ScoreCategory category) {
        switch (category) {
            case AI_LLM_VISIBILITY:
                return "aiLlmVisibilityScore";
            case TECHNICAL:
                return "techScore";
            case CONTENT:
                return "contentScore";
            case ACCESSIBILITY:
                return "accessibilityScore";
            case AUTHORITY:
                return "authorityScore";
            default:
                throw new IllegalArgumentException("Unknown category " + category);
        }
    }

    private static int requireScore(String url, JsonNode root, String field) {
        JsonNode value = root.get(field);
        if (value == null || !value.isNumber()) {
            throw new PageAnalysisException("Invalid analysis response for " + url + ": missing " + field);
        }
        long rounded = Math.round(value.asDouble());
        if (rounded < CategoryScores.MIN_SCORE || rounded > CategoryScores.MAX_SCORE) {
            throw new PageAnalysisException(
                    "Invalid analysis response for " + url + ": " + field + " out of range (" + rounded + ")");
        }
        return (int) rounded;
    }

    private static List<String> readRecommendations(JsonNode node) {
        List<String> recommendations = new ArrayList<>();
        if (node.isArray()) {
            addTrimmed(node, recommendations);
        } else if (node.isObject()) {
            for (String priority : RECOMMENDATION_PRIORITIES) {
                addTrimmed(node.path(priority), recommendations);
            }
        }
        return recommendations;
    }

    private static void addTrimmed(JsonNode items, List<String> target) {
        if (!items.isArray()) {
            return;
        }
        for (JsonNode item : items) {
            String text = item.isTextual() ? item.asText().trim() : "";
            if (!text.isEmpty()) {
                target.add(text);
            }
        }
    }

    static String cleanJson(String raw) {
        if (raw == null) return "{}";
        String s = raw.trim();
        if (s.startsWith("```")) {
            s = s.replaceAll("(?s)```(?:json)?\\s*", "").replaceAll("```\\s*", "");
        }
        if (!s.startsWith("{")) {
            int first = s.indexOf('{');
            int last = s.lastIndexOf('}');
            if (first >= 0 && last >= first) {
                return s.substring(first, last + 1);
            }
        }
        return s;
    }
}
