package com.ryuqq.hustle.core.retry;

import com.ryuqq.hustle.core.exception.ValidationException;
import com.ryuqq.hustle.core.observer.HustleEvent;
import com.ryuqq.hustle.core.observer.HustleObserver;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * 단일 작업에 대한 재시도 + Exponential Backoff 래퍼.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * for attempt in 1..maxAttempts:
 *   call()
 *     ├─ 성공 → Succeeded(value, attempt) 즉시 반환 (추가 대기 없음)
 *     └─ 실패
 *          ├─ 재시도 가능 + 남은 시도 있음
 *          │    → delay 계산 → retry.scheduled 이벤트 → sleep → 다음 시도
 *          └─ 마지막 시도 또는 재시도 불가
 *               → retry.exhausted 이벤트 → Exhausted(error, attempt)
 * </pre>
 *
 * <p><strong>재시도 불가 오류:</strong></p>
 * <ul>
 *   <li>{@link ValidationException} - 입력 계약 위반</li>
 *   <li>{@link InterruptedException} - 스레드 인터럽트</li>
 * </ul>
 *
 * <p>Backoff 대기 중 인터럽트가 발생하면 인터럽트 플래그를 복원하고,
 * 마지막 작업 오류를 suppressed로 담은 InterruptedException으로 종료합니다.</p>
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public final class RetryPolicy {

    private static final Predicate<Exception> DEFAULT_RETRYABLE =
        e -> !(e instanceof ValidationException) && !(e instanceof InterruptedException);

    private final RetryConfig config;
    private final BackoffCalculator backoffCalculator;
    private final Sleeper sleeper;
    private final Predicate<Exception> retryable;

    /**
     * 생성자 (실제 스레드 sleep 사용).
     *
     * @param config 재시도 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public RetryPolicy(RetryConfig config) {
        this(config, Sleeper.threadSleeper());
    }

    /**
     * 생성자 (Sleeper 주입).
     *
     * @param config 재시도 설정
     * @param sleeper 백오프 대기 구현
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetryPolicy(RetryConfig config, Sleeper sleeper) {
        this(config, sleeper, DEFAULT_RETRYABLE);
    }

    /**
     * 생성자 (재시도 대상 판별 조건 주입).
     *
     * <p>ValidationException과 InterruptedException은 retryable 조건과 무관하게 재시도되지 않습니다.</p>
     *
     * @param config 재시도 설정
     * @param sleeper 백오프 대기 구현
     * @param retryable 재시도 대상 오류 판별 조건
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetryPolicy(RetryConfig config, Sleeper sleeper, Predicate<Exception> retryable) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (retryable == null) {
            throw new IllegalArgumentException("retryable cannot be null");
        }
        this.config = config;
        this.backoffCalculator = new BackoffCalculator(config);
        this.sleeper = sleeper;
        this.retryable = retryable;
    }

    /**
     * 기본 설정 ({@link RetryConfig#defaults()}).
     *
     * @return RetryPolicy 인스턴스
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(RetryConfig.defaults());
    }

    /**
     * 재시도 없음 ({@link RetryConfig#none()}).
     *
     * @return RetryPolicy 인스턴스
     */
    public static RetryPolicy none() {
        return new RetryPolicy(RetryConfig.none());
    }

    /**
     * 설정으로 생성.
     *
     * @param config 재시도 설정
     * @return RetryPolicy 인스턴스
     */
    public static RetryPolicy of(RetryConfig config) {
        return new RetryPolicy(config);
    }

    /**
     * 작업 실행 (기본 SLF4J Observer 사용).
     *
     * @param operation 이벤트에 기록할 작업 이름
     * @param call 실행할 작업
     * @param <T> 결과 타입
     * @return 실행 결과 (Succeeded 또는 Exhausted)
     */
    public <T> RetryResult<T> execute(String operation, Callable<T> call) {
        return execute(operation, call, HustleObserver.logging());
    }

    /**
     * 작업 실행.
     *
     * @param operation 이벤트에 기록할 작업 이름
     * @param call 실행할 작업
     * @param observer 이벤트 수신자
     * @param <T> 결과 타입
     * @return 실행 결과 (Succeeded 또는 Exhausted)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public <T> RetryResult<T> execute(String operation, Callable<T> call, HustleObserver observer) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }
        if (observer == null) {
            throw new IllegalArgumentException("observer cannot be null");
        }

        int maxAttempts = config.maxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                return new Succeeded<>(call.call(), attempt);
            } catch (Exception e) {
                if (attempt >= maxAttempts || !isRetryable(e)) {
                    observer.onEvent(HustleEvent.of(HustleEvent.RETRY_EXHAUSTED,
                        "operation", operation,
                        "attempt", attempt,
                        "maxAttempts", maxAttempts,
                        "error", describe(e)));
                    return new Exhausted<>(e, attempt);
                }

                Duration delay = backoffCalculator.calculate(attempt - 1);
                observer.onEvent(HustleEvent.of(HustleEvent.RETRY_SCHEDULED,
                    "operation", operation,
                    "attempt", attempt,
                    "maxAttempts", maxAttempts,
                    "delayMs", delay.toMillis(),
                    "error", describe(e)));

                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    interrupted.addSuppressed(e);
                    return new Exhausted<>(interrupted, attempt);
                }
            }
        }
    }

    /**
     * 설정 조회.
     *
     * @return 재시도 설정
     */
    public RetryConfig config() {
        return config;
    }

    private boolean isRetryable(Exception e) {
        return DEFAULT_RETRYABLE.test(e) && retryable.test(e);
    }

    private static String describe(Exception e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
