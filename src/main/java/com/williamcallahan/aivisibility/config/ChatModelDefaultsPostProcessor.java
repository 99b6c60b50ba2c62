package com.williamcallahan.aivisibility.config;

import java.util.Map;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

/**
 * Switches the OpenAI chat model off when no API key is configured.
 *
 * <p>Without a key the OpenAI auto-configuration refuses to start; with the model set to
 * {@code none} the application starts and {@link AiConfig} falls back to an analyzer that
 * reports every page as unavailable.</p>
 */
public class ChatModelDefaultsPostProcessor implements EnvironmentPostProcessor, Ordered {

    static final String CHAT_MODEL_PROPERTY = "spring.ai.model.chat";
    static final String PROPERTY_SOURCE_NAME = "chatModelWithoutApiKey";
    private static final String OPENAI = "openai";

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        String chatModel = environment.getProperty(CHAT_MODEL_PROPERTY, OPENAI);
        if (!OPENAI.equalsIgnoreCase(chatModel.trim())) {
            return;
        }
        if (hasText(environment.getProperty("spring.ai.openai.chat.api-key"))
                || hasText(environment.getProperty("spring.ai.openai.api-key"))) {
            return;
        }
        environment.getPropertySources().addFirst(
                new MapPropertySource(PROPERTY_SOURCE_NAME, Map.of(CHAT_MODEL_PROPERTY, "none")));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    // Runs after application.yml has been loaded
    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE;
    }
}
