package com.ryuqq.hustle.core.retry;

import com.ryuqq.hustle.core.exception.ConfigurationException;

import java.time.Duration;

/**
 * RetryPolicy 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최초 시도를 포함한 최대 시도 횟수 (기본 4 = 재시도 3회)</li>
 *   <li>initialDelay: 첫 재시도 전 대기 시간 (기본 1초)</li>
 *   <li>backoffMultiplier: 재시도마다 곱해지는 배수 (기본 2.0)</li>
 *   <li>jitter: 대기 시간에 더해지는 무작위 값의 상한 (기본 없음)</li>
 * </ul>
 *
 * @author Hustle Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상이어야 함)
 * @param initialDelay 최초 대기 시간 (0 이상이어야 함)
 * @param backoffMultiplier 백오프 배수 (1.0 이상이어야 함)
 * @param jitter Jitter 상한 (null 가능, 0 이상이어야 함)
 */
public record RetryConfig(
    int maxAttempts,
    Duration initialDelay,
    double backoffMultiplier,
    Duration jitter
) {

    public static final int DEFAULT_MAX_ATTEMPTS = 4;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws ConfigurationException 파라미터 검증 실패 시
     */
    public RetryConfig {
        if (maxAttempts < 1) {
            throw new ConfigurationException(
                "maxAttempts must be >= 1 (current: " + maxAttempts + ")"
            );
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new ConfigurationException(
                "initialDelay must be non-negative (current: " + initialDelay + ")"
            );
        }
        if (Double.isNaN(backoffMultiplier) || backoffMultiplier < 1.0) {
            throw new ConfigurationException(
                "backoffMultiplier must be >= 1.0 (current: " + backoffMultiplier + ")"
            );
        }
        if (jitter != null && jitter.isNegative()) {
            throw new ConfigurationException(
                "jitter must be non-negative (current: " + jitter + ")"
            );
        }
    }

    /**
     * 기본 설정: 4회 시도, 1초, 2배, jitter 없음.
     *
     * @return 기본 RetryConfig
     */
    public static RetryConfig defaults() {
        return new RetryConfig(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_DELAY, DEFAULT_BACKOFF_MULTIPLIER, null);
    }

    /**
     * 재시도 없음 (1회 시도).
     *
     * @return 재시도하지 않는 RetryConfig
     */
    public static RetryConfig none() {
        return new RetryConfig(1, Duration.ZERO, DEFAULT_BACKOFF_MULTIPLIER, null);
    }

    /**
     * 시도 횟수와 최초 대기 시간만 지정 (배수 2.0, jitter 없음).
     *
     * @param maxAttempts 최대 시도 횟수
     * @param initialDelay 최초 대기 시간
     * @return RetryConfig 인스턴스
     */
    public static RetryConfig of(int maxAttempts, Duration initialDelay) {
        return new RetryConfig(maxAttempts, initialDelay, DEFAULT_BACKOFF_MULTIPLIER, null);
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withMaxAttempts(int maxAttempts) {
        return new RetryConfig(maxAttempts, initialDelay, backoffMultiplier, jitter);
    }

    /**
     * initialDelay만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withInitialDelay(Duration initialDelay) {
        return new RetryConfig(maxAttempts, initialDelay, backoffMultiplier, jitter);
    }

    /**
     * backoffMultiplier만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withBackoffMultiplier(double backoffMultiplier) {
        return new RetryConfig(maxAttempts, initialDelay, backoffMultiplier, jitter);
    }

    /**
     * jitter만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withJitter(Duration jitter) {
        return new RetryConfig(maxAttempts, initialDelay, backoffMultiplier, jitter);
    }
}
