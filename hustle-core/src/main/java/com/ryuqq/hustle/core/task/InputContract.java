package com.ryuqq.hustle.core.task;

import com.ryuqq.hustle.core.exception.ValidationException;

import java.util.Map;

/**
 * 작업 단위의 입력 형태 계약.
 *
 * <p>change가 느슨한 Map일 때만 적용되며, Map을 검증하고 작업 단위가 기대하는
 * 입력 타입으로 변환(coerce)합니다.</p>
 *
 * @param <I> 변환된 입력 타입
 *
 * @author Hustle Team
 * @since 1.0.0
 * @see MapSchemaContract
 */
@FunctionalInterface
public interface InputContract<I> {

    /**
     * Map 검증 및 변환.
     *
     * @param raw 검증할 change
     * @return 변환된 입력
     * @throws ValidationException 계약 위반 시
     */
    I validate(Map<String, Object> raw);
}
