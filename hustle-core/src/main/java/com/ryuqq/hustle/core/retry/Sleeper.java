package com.ryuqq.hustle.core.retry;

import java.time.Duration;

/**
 * 백오프 대기 추상화.
 *
 * <p>테스트에서 실제 대기 없이 대기 시간을 기록할 수 있도록 분리되어 있습니다.</p>
 *
 * @author Hustle Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 지정된 시간만큼 대기.
     *
     * @param duration 대기 시간
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * {@link Thread#sleep(long, int)} 기반 기본 구현.
     *
     * @return 실제 스레드를 블로킹하는 Sleeper
     */
    static Sleeper threadSleeper() {
        return duration -> {
            if (duration.isZero()) {
                return;
            }
            long millis = duration.toMillis();
            int nanos = (int) (duration.toNanos() - millis * 1_000_000L);
            Thread.sleep(millis, nanos);
        };
    }
}
