package com.ryuqq.hustle.adapter.openai;

import com.ryuqq.hustle.core.exception.ConfigurationException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * chat-completions 엔드포인트 설정.
 *
 * <p>불변 설정이며 {@code withX} 메서드로 변경된 복사본을 만듭니다.</p>
 *
 * @param baseUrl base URL (끝의 '/'는 제거됨)
 * @param apiKey Bearer 토큰 (null이면 Authorization 헤더 생략)
 * @param headers 추가 헤더 (불변 복사)
 * @param requestTimeout 요청 타임아웃 (양수)
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public record ChatEndpointConfig(
    String baseUrl,
    String apiKey,
    Map<String, String> headers,
    Duration requestTimeout
) {

    /** 기본 요청 타임아웃. */
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);

    /**
     * Compact Constructor (검증 및 정규화).
     *
     * @throws ConfigurationException baseUrl이 비어있거나 requestTimeout이 양수가 아닌 경우
     */
    public ChatEndpointConfig {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new ConfigurationException("baseUrl cannot be null or blank");
        }
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new ConfigurationException("requestTimeout must be positive (current: " + requestTimeout + ")");
        }
        String normalized = baseUrl.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        baseUrl = normalized;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    /**
     * base URL과 API 키만으로 생성 (헤더 없음, 기본 타임아웃).
     *
     * @param baseUrl base URL
     * @param apiKey API 키
     * @return 설정
     */
    public static ChatEndpointConfig of(String baseUrl, String apiKey) {
        return new ChatEndpointConfig(baseUrl, apiKey, Map.of(), DEFAULT_REQUEST_TIMEOUT);
    }

    /**
     * 프로세스 환경 변수에서 설정 생성.
     *
     * @param provider 제공자
     * @return 설정
     * @throws ConfigurationException 필요한 환경 변수가 없는 경우
     */
    public static ChatEndpointConfig fromEnvironment(LlmProvider provider) {
        return fromEnvironment(provider, System.getenv());
    }

    /**
     * 주어진 환경 변수 맵에서 설정 생성.
     *
     * @param provider 제공자
     * @param environment 환경 변수 맵
     * @return 설정
     * @throws IllegalArgumentException provider 또는 environment가 null인 경우
     * @throws ConfigurationException 필요한 환경 변수가 없는 경우
     */
    public static ChatEndpointConfig fromEnvironment(LlmProvider provider, Map<String, String> environment) {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }

        String baseUrl = provider.defaultBaseUrl() != null
            ? provider.defaultBaseUrl()
            : require(environment, LlmProvider.CUSTOM_URL_VARIABLE, provider);
        String apiKey = provider.fixedApiKey() != null
            ? provider.fixedApiKey()
            : require(environment, provider.apiKeyVariable(), provider);

        return new ChatEndpointConfig(baseUrl, apiKey, provider.defaultHeaders(), DEFAULT_REQUEST_TIMEOUT);
    }

    private static String require(Map<String, String> environment, String variable, LlmProvider provider) {
        String value = environment.get(variable);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(variable + " must be set for provider " + provider);
        }
        return value;
    }

    /**
     * chat-completions 엔드포인트 URL.
     *
     * @return baseUrl + "/chat/completions"
     */
    public String completionsUrl() {
        return baseUrl + "/chat/completions";
    }

    /**
     * API 키 변경.
     *
     * @param apiKey 새 API 키
     * @return 새 설정
     */
    public ChatEndpointConfig withApiKey(String apiKey) {
        return new ChatEndpointConfig(baseUrl, apiKey, headers, requestTimeout);
    }

    /**
     * base URL 변경.
     *
     * @param baseUrl 새 base URL
     * @return 새 설정
     */
    public ChatEndpointConfig withBaseUrl(String baseUrl) {
        return new ChatEndpointConfig(baseUrl, apiKey, headers, requestTimeout);
    }

    /**
     * 헤더 추가 (같은 이름은 덮어씀).
     *
     * @param name 헤더 이름
     * @param value 헤더 값
     * @return 새 설정
     */
    public ChatEndpointConfig withHeader(String name, String value) {
        Map<String, String> merged = new LinkedHashMap<>(headers);
        merged.put(name, value);
        return new ChatEndpointConfig(baseUrl, apiKey, merged, requestTimeout);
    }

    /**
     * 요청 타임아웃 변경.
     *
     * @param requestTimeout 새 타임아웃
     * @return 새 설정
     */
    public ChatEndpointConfig withRequestTimeout(Duration requestTimeout) {
        return new ChatEndpointConfig(baseUrl, apiKey, headers, requestTimeout);
    }

    @Override
    public String toString() {
        return "ChatEndpointConfig[baseUrl=" + baseUrl
            + ", apiKey=" + (apiKey == null ? "none" : "****")
            + ", headers=" + headers.keySet()
            + ", requestTimeout=" + requestTimeout + "]";
    }
}
