package com.ryuqq.hustle.adapter.openai;

import java.util.Map;

/**
 * OpenAI 호환 chat-completions 제공자.
 *
 * <p>제공자별 기본 base URL, API 키 환경 변수, 추가 헤더를 정의합니다.</p>
 *
 * <ul>
 *   <li>OPENROUTER: {@code OPENROUTER_API_KEY}, HTTP-Referer/X-Title 헤더 추가</li>
 *   <li>OPENAI: {@code OPENAI_API_KEY}</li>
 *   <li>OLLAMA: 로컬 서버, 고정 키 {@code "ollama"}</li>
 *   <li>CUSTOM: {@code CUSTOM_LLM_URL}, {@code CUSTOM_API_KEY}</li>
 * </ul>
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public enum LlmProvider {

    OPENROUTER("https://openrouter.ai/api/v1", "OPENROUTER_API_KEY", null,
        Map.of("HTTP-Referer", "https://localhost", "X-Title", "AgenticHustler")),

    OPENAI("https://api.openai.com/v1", "OPENAI_API_KEY", null, Map.of()),

    OLLAMA("http://localhost:11434/v1", null, "ollama", Map.of()),

    CUSTOM(null, "CUSTOM_API_KEY", null, Map.of());

    /** CUSTOM 제공자의 base URL 환경 변수. */
    public static final String CUSTOM_URL_VARIABLE = "CUSTOM_LLM_URL";

    private final String defaultBaseUrl;
    private final String apiKeyVariable;
    private final String fixedApiKey;
    private final Map<String, String> defaultHeaders;

    LlmProvider(String defaultBaseUrl, String apiKeyVariable, String fixedApiKey, Map<String, String> defaultHeaders) {
        this.defaultBaseUrl = defaultBaseUrl;
        this.apiKeyVariable = apiKeyVariable;
        this.fixedApiKey = fixedApiKey;
        this.defaultHeaders = defaultHeaders;
    }

    /**
     * 기본 base URL (CUSTOM은 null).
     *
     * @return base URL
     */
    public String defaultBaseUrl() {
        return defaultBaseUrl;
    }

    /**
     * API 키를 읽을 환경 변수 이름 (고정 키 제공자는 null).
     *
     * @return 환경 변수 이름
     */
    public String apiKeyVariable() {
        return apiKeyVariable;
    }

    /**
     * 고정 API 키 (OLLAMA만 해당).
     *
     * @return 고정 키 또는 null
     */
    public String fixedApiKey() {
        return fixedApiKey;
    }

    /**
     * 모든 요청에 추가할 헤더.
     *
     * @return 불변 헤더 맵
     */
    public Map<String, String> defaultHeaders() {
        return defaultHeaders;
    }
}
