package com.ryuqq.hustle.core.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential Backoff (+ 선택적 Jitter) 계산기.
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = initialDelay * multiplier^retryIndex + random(0, jitter)
 * </pre>
 *
 * <p><strong>예시 (initialDelay=1000ms, multiplier=2.0, jitter 없음):</strong></p>
 * <ul>
 *   <li>retryIndex=0: 1000ms (첫 번째 실패 후)</li>
 *   <li>retryIndex=1: 2000ms</li>
 *   <li>retryIndex=2: 4000ms</li>
 * </ul>
 *
 * <p>계산 결과가 표현 범위를 넘으면 {@code Long.MAX_VALUE} 나노초로 포화됩니다.</p>
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

    private final Duration initialDelay;
    private final double multiplier;
    private final Duration jitter;

    /**
     * RetryConfig로부터 생성.
     *
     * @param config 재시도 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public BackoffCalculator(RetryConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.initialDelay = config.initialDelay();
        this.multiplier = config.backoffMultiplier();
        this.jitter = config.jitter();
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param retryIndex 재시도 순번 (0부터 시작, 0 = 첫 번째 실패 직후)
     * @return 재시도 전 대기 시간
     * @throws IllegalArgumentException retryIndex가 음수인 경우
     */
    public Duration calculate(int retryIndex) {
        if (retryIndex < 0) {
            throw new IllegalArgumentException(
                "retryIndex must be non-negative (current: " + retryIndex + ")"
            );
        }

        // 1. 지수적 백오프 (double 연산 후 long 범위로 포화)
        double exponential = saturatedNanos(initialDelay) * Math.pow(multiplier, retryIndex);
        long delayNanos = exponential >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) exponential;

        // 2. Jitter 추가 (0 ~ jitter)
        if (jitter != null && !jitter.isZero()) {
            long jitterBound = saturatedNanos(jitter);
            long jitterNanos = ThreadLocalRandom.current()
                .nextLong(jitterBound == Long.MAX_VALUE ? jitterBound : jitterBound + 1);
            delayNanos = delayNanos > Long.MAX_VALUE - jitterNanos ? Long.MAX_VALUE : delayNanos + jitterNanos;
        }

        return Duration.ofNanos(delayNanos);
    }

    private static long saturatedNanos(Duration duration) {
        return duration.compareTo(MAX_NANOS) >= 0 ? Long.MAX_VALUE : duration.toNanos();
    }
}
