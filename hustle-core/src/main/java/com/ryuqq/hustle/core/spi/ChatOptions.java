package com.ryuqq.hustle.core.spi;

/**
 * Chat completion 요청 옵션 (불변 record).
 *
 * <p>null 필드는 요청에 포함되지 않으며 provider 기본값을 따릅니다.</p>
 *
 * @param temperature 샘플링 온도 (0.0 ~ 2.0, null 가능)
 * @param maxTokens 최대 출력 토큰 수 (양수, null 가능)
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public record ChatOptions(
    Double temperature,
    Integer maxTokens
) {

    public static final double DEFAULT_TEMPERATURE = 0.7;

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 범위를 벗어난 값인 경우
     */
    public ChatOptions {
        if (temperature != null && (temperature < 0.0 || temperature > 2.0)) {
            throw new IllegalArgumentException(
                "temperature must be between 0.0 and 2.0 (current: " + temperature + ")"
            );
        }
        if (maxTokens != null && maxTokens <= 0) {
            throw new IllegalArgumentException(
                "maxTokens must be positive (current: " + maxTokens + ")"
            );
        }
    }

    /**
     * 기본 옵션: temperature 0.7, maxTokens 미지정.
     *
     * @return 기본 ChatOptions
     */
    public static ChatOptions defaults() {
        return new ChatOptions(DEFAULT_TEMPERATURE, null);
    }

    /**
     * temperature만 변경한 새 인스턴스 생성.
     */
    public ChatOptions withTemperature(Double temperature) {
        return new ChatOptions(temperature, maxTokens);
    }

    /**
     * maxTokens만 변경한 새 인스턴스 생성.
     */
    public ChatOptions withMaxTokens(Integer maxTokens) {
        return new ChatOptions(temperature, maxTokens);
    }
}
