package com.williamcallahan.aivisibility.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.aivisibility.service.ChatClientPageAnalyzer;
import com.williamcallahan.aivisibility.service.PageAnalyzer;
import com.williamcallahan.aivisibility.service.UnavailablePageAnalyzer;
import io.netty.channel.ChannelOption;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
public class AiConfig {
    private static final Logger log = LoggerFactory.getLogger(AiConfig.class);

    // ChatModel is auto-configured by the Spring AI OpenAI starter from spring.ai.openai.*
    // and is absent when spring.ai.model.chat=none

    @Bean
    @ConditionalOnMissingBean(PageAnalyzer.class)
    public PageAnalyzer pageAnalyzer(
            ObjectProvider<ChatModel> chatModelProvider,
            ObjectMapper objectMapper,
            AppProperties appProperties,
            Clock clock) {
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null) {
            log.warn("No chat model configured - page analyses will fail until one is enabled");
            return new UnavailablePageAnalyzer();
        }
        log.info("Page analysis backed by chat model {}", chatModel.getClass().getSimpleName());
        return new ChatClientPageAnalyzer(ChatClient.builder(chatModel).build(), objectMapper, appProperties, clock);
    }

    @Bean
    public WebClient.Builder webClientBuilder() {
        // Polls are small and fast; fail a single poll quickly so the next one can run
        HttpClient httpClient = HttpClient.create()
            .responseTimeout(Duration.ofSeconds(30))
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10000);

        return WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
