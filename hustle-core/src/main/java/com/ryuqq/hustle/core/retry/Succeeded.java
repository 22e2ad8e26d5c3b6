package com.ryuqq.hustle.core.retry;

/**
 * 성공 결과.
 *
 * @param value 성공 값 (null 가능)
 * @param attempts 성공까지 수행한 시도 횟수 (1 이상)
 * @param <T> 성공 값 타입
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public record Succeeded<T>(
    T value,
    int attempts
) implements RetryResult<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException attempts가 양수가 아닌 경우
     */
    public Succeeded {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be positive (current: " + attempts + ")");
        }
        // value는 null 허용
    }

    @Override
    public T getOrThrow() {
        return value;
    }
}
