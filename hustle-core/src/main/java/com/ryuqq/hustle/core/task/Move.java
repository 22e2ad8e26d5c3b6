package com.ryuqq.hustle.core.task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 작업 단위가 deliver 단계에서 선언하는 라우팅 의도.
 *
 * <p>스케줄러는 route 이름으로 작업 단위의 링크 테이블을 조회하고,
 * payload를 다음 봉투의 change에 병합합니다.</p>
 *
 * @param route 따라갈 route 이름
 * @param payload 다음 봉투 change에 병합할 필드 (null 가능, 불변)
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public record Move(
    String route,
    Map<String, Object> payload
) {

    /**
     * 기본 route 이름.
     */
    public static final String FORWARD = "forward";

    private static final Move DEFAULT = new Move(FORWARD, null);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException route가 null이거나 빈 문자열인 경우
     */
    public Move {
        if (route == null || route.isBlank()) {
            throw new IllegalArgumentException("route cannot be null or blank");
        }
        // payload 값에는 null이 올 수 있으므로 Map.copyOf 대신 LinkedHashMap 사용
        if (payload != null) {
            payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        }
    }

    /**
     * 기본 Move (route "forward", payload 없음).
     *
     * @return 기본 Move
     */
    public static Move forward() {
        return DEFAULT;
    }

    /**
     * payload 없는 Move 생성.
     *
     * @param route route 이름
     * @return Move 인스턴스
     */
    public static Move to(String route) {
        return new Move(route, null);
    }

    /**
     * payload를 포함한 Move 생성.
     *
     * @param route route 이름
     * @param payload 병합할 필드
     * @return Move 인스턴스
     */
    public static Move to(String route, Map<String, Object> payload) {
        return new Move(route, payload);
    }

    /**
     * payload 존재 여부.
     *
     * @return payload가 있으면 true
     */
    public boolean hasPayload() {
        return payload != null && !payload.isEmpty();
    }
}
