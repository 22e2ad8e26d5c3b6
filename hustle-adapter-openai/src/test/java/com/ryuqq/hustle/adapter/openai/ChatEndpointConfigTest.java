package com.ryuqq.hustle.adapter.openai;

import com.ryuqq.hustle.core.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ChatEndpointConfig 유닛 테스트.
 *
 * @author Hustle Team
 * @since 1.0.0
 */
class ChatEndpointConfigTest {

    @Test
    void fromEnvironment_OPENROUTER는_키와_식별_헤더를_설정함() {
        // when
        ChatEndpointConfig config = ChatEndpointConfig.fromEnvironment(
            LlmProvider.OPENROUTER, Map.of("OPENROUTER_API_KEY", "or-key")
        );

        // then
        assertThat(config.baseUrl()).isEqualTo("https://openrouter.ai/api/v1");
        assertThat(config.apiKey()).isEqualTo("or-key");
        assertThat(config.headers())
            .containsEntry("HTTP-Referer", "https://localhost")
            .containsEntry("X-Title", "AgenticHustler");
    }

    @Test
    void fromEnvironment_OPENAI_키_누락_시_ConfigurationException() {
        // when & then
        assertThatThrownBy(() -> ChatEndpointConfig.fromEnvironment(LlmProvider.OPENAI, Map.of()))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("OPENAI_API_KEY");
    }

    @Test
    void fromEnvironment_OLLAMA는_환경_변수_없이_고정_키_사용() {
        // when
        ChatEndpointConfig config = ChatEndpointConfig.fromEnvironment(LlmProvider.OLLAMA, Map.of());

        // then
        assertThat(config.baseUrl()).isEqualTo("http://localhost:11434/v1");
        assertThat(config.apiKey()).isEqualTo("ollama");
        assertThat(config.headers()).isEmpty();
    }

    @Test
    void fromEnvironment_CUSTOM은_URL_환경_변수를_요구함() {
        // when & then
        assertThatThrownBy(() -> ChatEndpointConfig.fromEnvironment(
            LlmProvider.CUSTOM, Map.of("CUSTOM_API_KEY", "k")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("CUSTOM_LLM_URL");
    }

    @Test
    void fromEnvironment_CUSTOM_URL과_키로_설정됨() {
        // when
        ChatEndpointConfig config = ChatEndpointConfig.fromEnvironment(
            LlmProvider.CUSTOM, Map.of("CUSTOM_LLM_URL", "http://llm.internal/v1/", "CUSTOM_API_KEY", "k")
        );

        // then
        assertThat(config.baseUrl()).isEqualTo("http://llm.internal/v1");
        assertThat(config.completionsUrl()).isEqualTo("http://llm.internal/v1/chat/completions");
    }

    @Test
    void 생성자_타임아웃이_0이면_ConfigurationException() {
        // when & then
        assertThatThrownBy(() -> new ChatEndpointConfig("http://x", null, Map.of(), Duration.ZERO))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("requestTimeout must be positive");
    }

    @Test
    void toString_API_키를_노출하지_않음() {
        // when
        String rendered = ChatEndpointConfig.of("http://x", "super-secret").toString();

        // then
        assertThat(rendered).doesNotContain("super-secret");
    }
}
