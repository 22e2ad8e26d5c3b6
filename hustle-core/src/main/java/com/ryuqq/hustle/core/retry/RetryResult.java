package com.ryuqq.hustle.core.retry;

/**
 * RetryPolicy 실행 결과.
 *
 * <p>두 가지 결과 중 하나를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Succeeded}: 어느 시도에서든 성공함</li>
 *   <li>{@link Exhausted}: 시도 횟수 소진 또는 재시도 불가 오류로 종료됨</li>
 * </ul>
 *
 * <p>두 경우 모두 실제로 수행한 시도 횟수를 담고 있습니다.</p>
 *
 * @param <T> 성공 값 타입
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public sealed interface RetryResult<T> permits Succeeded, Exhausted {

    /**
     * 실제 수행한 시도 횟수 (1 이상).
     *
     * @return 시도 횟수
     */
    int attempts();

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSuccess() {
        return this instanceof Succeeded;
    }

    /**
     * 성공 값을 반환하거나 마지막 오류를 그대로 다시 던짐.
     *
     * <p>오류는 래핑되지 않으므로 호출자는 원래 예외 타입을 그대로 받습니다.</p>
     *
     * @return 성공 값
     * @throws Exception 소진된 경우 마지막 오류
     */
    T getOrThrow() throws Exception;
}
