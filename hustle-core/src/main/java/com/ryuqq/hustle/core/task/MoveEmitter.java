package com.ryuqq.hustle.core.task;

import java.util.Map;

/**
 * deliver 단계에서 라우팅 의도를 선언하는 수단.
 *
 * <p>한 번의 step에서 여러 번 호출할 수 있으며, 호출마다 하나의 분기가 생깁니다.
 * 한 번도 호출하지 않으면 기본 Move("forward")가 사용됩니다.</p>
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public interface MoveEmitter {

    /**
     * Move 선언.
     *
     * @param route route 이름
     * @param payload 다음 봉투 change에 병합할 필드 (null 가능)
     */
    void emit(String route, Map<String, Object> payload);

    /**
     * payload 없는 Move 선언.
     *
     * @param route route 이름
     */
    default void emit(String route) {
        emit(route, null);
    }

    /**
     * "forward" route로 Move 선언.
     */
    default void forward() {
        emit(Move.FORWARD, null);
    }

    /**
     * "forward" route로 payload와 함께 Move 선언.
     *
     * @param payload 병합할 필드
     */
    default void forward(Map<String, Object> payload) {
        emit(Move.FORWARD, payload);
    }
}
