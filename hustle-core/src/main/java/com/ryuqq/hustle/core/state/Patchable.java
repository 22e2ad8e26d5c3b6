package com.ryuqq.hustle.core.state;

import java.util.Map;

/**
 * 필드 단위 병합(patch)을 지원하는 구조화 change 값.
 *
 * @param <T> 자기 자신 타입
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public interface Patchable<T> extends Forkable<T> {

    /**
     * patch 적용.
     *
     * <p>fork()로 만들어진 복사본에 대해서만 호출됩니다.
     * patch에 없는 필드는 변경하지 않아야 합니다.</p>
     *
     * @param fields 병합할 필드 (불변)
     * @return patch가 적용된 값 (this 또는 새 인스턴스)
     */
    T patch(Map<String, Object> fields);
}
