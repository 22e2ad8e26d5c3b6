package com.ryuqq.hustle.core.observer;

import java.util.List;

/**
 * 구조화 이벤트 수신자 (Observer).
 *
 * <p>스케줄러와 RetryPolicy는 이 인터페이스로만 이벤트를 방출하며,
 * 로깅/텔레메트리 구현과 분리됩니다.</p>
 *
 * <p><strong>구현 지침:</strong></p>
 * <ul>
 *   <li>실행은 순차적이므로 thread-safe할 필요는 없습니다.</li>
 *   <li>onEvent()에서 발생한 예외는 실행 중인 run을 중단시킵니다.</li>
 * </ul>
 *
 * @author Hustle Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface HustleObserver {

    /**
     * 이벤트 수신.
     *
     * @param event 방출된 이벤트
     */
    void onEvent(HustleEvent event);

    /**
     * 아무 동작도 하지 않는 Observer.
     *
     * @return NoOp Observer
     */
    static HustleObserver noop() {
        return event -> {
            // NoOp
        };
    }

    /**
     * SLF4J 로깅 Observer (기본값).
     *
     * @return Slf4jHustleObserver 인스턴스
     */
    static HustleObserver logging() {
        return Slf4jHustleObserver.INSTANCE;
    }

    /**
     * 여러 Observer에게 순서대로 전달하는 Observer.
     *
     * @param observers 대상 Observer 목록
     * @return 합성 Observer
     * @throws IllegalArgumentException observers에 null이 포함된 경우
     */
    static HustleObserver composite(HustleObserver... observers) {
        for (HustleObserver observer : observers) {
            if (observer == null) {
                throw new IllegalArgumentException("observers cannot contain null");
            }
        }
        List<HustleObserver> targets = List.of(observers);
        return event -> {
            for (HustleObserver target : targets) {
                target.onEvent(event);
            }
        };
    }
}
