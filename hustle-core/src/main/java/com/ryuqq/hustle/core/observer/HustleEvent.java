package com.ryuqq.hustle.core.observer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 엔진이 방출하는 구조화 이벤트.
 *
 * <p>이벤트 이름과 순서가 보존되는 key-value 필드로 구성됩니다.
 * 렌더링 방식(로그, 메트릭, 트레이스)은 {@link HustleObserver} 구현체가 결정하며,
 * 엔진 동작은 이벤트 소비 방식에 의존하지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * HustleEvent event = HustleEvent.of(HustleEvent.RETRY_SCHEDULED,
 *     "operation", "MarketAnalyst",
 *     "attempt", 1,
 *     "delayMs", 1000);
 * </pre>
 *
 * @param name 이벤트 이름 (예: unit.started)
 * @param fields 이벤트 필드 (불변, 삽입 순서 유지)
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public record HustleEvent(
    String name,
    Map<String, Object> fields
) {

    public static final String RUN_STARTED = "run.started";
    public static final String RUN_COMPLETED = "run.completed";
    public static final String RUN_ABORTED = "run.aborted";
    public static final String UNIT_STARTED = "unit.started";
    public static final String UNIT_COMPLETED = "unit.completed";
    public static final String BRANCH_TERMINATED = "branch.terminated";
    public static final String BRANCH_FAILED = "branch.failed";
    public static final String RETRY_SCHEDULED = "retry.scheduled";
    public static final String RETRY_EXHAUSTED = "retry.exhausted";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     */
    public HustleEvent {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        // null 값을 허용해야 하므로 Map.copyOf 대신 LinkedHashMap 사용
        fields = fields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * key, value 쌍을 번갈아 받아 이벤트 생성.
     *
     * @param name 이벤트 이름
     * @param keyValues key1, value1, key2, value2, ...
     * @return HustleEvent 인스턴스
     * @throws IllegalArgumentException 인자 개수가 홀수이거나 key가 문자열이 아닌 경우
     */
    public static HustleEvent of(String name, Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must be key/value pairs (length: " + keyValues.length + ")");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (!(keyValues[i] instanceof String)) {
                throw new IllegalArgumentException("event field key must be a String (index: " + i + ")");
            }
            fields.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new HustleEvent(name, fields);
    }

    /**
     * 필드 값 조회.
     *
     * @param key 필드 이름
     * @return 필드 값 (없으면 null)
     */
    public Object field(String key) {
        return fields.get(key);
    }
}
