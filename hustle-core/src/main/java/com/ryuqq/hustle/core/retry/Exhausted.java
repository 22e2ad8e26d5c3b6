package com.ryuqq.hustle.core.retry;

/**
 * 실패 결과 (재시도 소진 또는 재시도 불가 오류).
 *
 * @param error 마지막 시도에서 발생한 원래 오류
 * @param attempts 수행한 시도 횟수 (1 이상)
 * @param <T> 성공 값 타입
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public record Exhausted<T>(
    Exception error,
    int attempts
) implements RetryResult<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException error가 null이거나 attempts가 양수가 아닌 경우
     */
    public Exhausted {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be positive (current: " + attempts + ")");
        }
    }

    @Override
    public T getOrThrow() throws Exception {
        throw error;
    }
}
