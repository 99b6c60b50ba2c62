package com.williamcallahan.aivisibility.config;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class ChatModelDefaultsPostProcessorTest {

    private final ChatModelDefaultsPostProcessor postProcessor = new ChatModelDefaultsPostProcessor();

    @Test
    @DisplayName("A blank OpenAI key disables the chat model")
    void disablesChatModelWithoutKey() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("spring.ai.model.chat", "openai")
                .withProperty("spring.ai.openai.api-key", "");

        postProcessor.postProcessEnvironment(environment, null);

        assertEquals("none", environment.getProperty("spring.ai.model.chat"));
    }

    @Test
    void keepsChatModelWhenKeyIsPresent() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("spring.ai.model.chat", "openai")
                .withProperty("spring.ai.openai.api-key", "sk-test");

        postProcessor.postProcessEnvironment(environment, null);

        assertEquals("openai", environment.getProperty("spring.ai.model.chat"));
        assertFalse(environment.getPropertySources().contains(ChatModelDefaultsPostProcessor.PROPERTY_SOURCE_NAME));
    }

    @Test
    void chatSpecificKeyCounts() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("spring.ai.openai.chat.api-key", "sk-chat");

        postProcessor.postProcessEnvironment(environment, null);

        assertNull(environment.getProperty("spring.ai.model.chat"));
    }

    @Test
    void leavesOtherProvidersAlone() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("spring.ai.model.chat", "none");

        postProcessor.postProcessEnvironment(environment, null);

        assertFalse(environment.getPropertySources().contains(ChatModelDefaultsPostProcessor.PROPERTY_SOURCE_NAME));
    }
}
