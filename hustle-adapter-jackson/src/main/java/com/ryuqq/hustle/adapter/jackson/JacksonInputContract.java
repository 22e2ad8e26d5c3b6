package com.ryuqq.hustle.adapter.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.hustle.core.exception.ValidationException;
import com.ryuqq.hustle.core.task.InputContract;

import java.util.List;
import java.util.Map;

/**
 * Jackson 기반 입력 계약.
 *
 * <p>느슨한 Map change를 record 또는 POJO로 변환합니다.
 * creator 속성이 누락되거나 null이면 {@link ValidationException}으로 거부합니다.</p>
 *
 * <p><strong>변환 규칙:</strong></p>
 * <ul>
 *   <li>FAIL_ON_MISSING_CREATOR_PROPERTIES, FAIL_ON_NULL_CREATOR_PROPERTIES 활성화</li>
 *   <li>대상 타입에 없는 키는 무시 (다른 작업 단위가 남긴 필드 허용)</li>
 *   <li>주입된 ObjectMapper는 복사하여 사용하므로 원본 설정은 변경되지 않음</li>
 * </ul>
 *
 * @param <I> 변환 대상 타입
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public final class JacksonInputContract<I> implements InputContract<I> {

    private final ObjectMapper mapper;
    private final Class<I> type;

    /**
     * 생성자.
     *
     * @param mapper 기반 ObjectMapper (모듈 등록 등 호출자 설정 유지)
     * @param type 변환 대상 타입
     * @throws IllegalArgumentException mapper 또는 type이 null인 경우
     */
    public JacksonInputContract(ObjectMapper mapper, Class<I> type) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        this.mapper = mapper.copy()
            .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.type = type;
    }

    /**
     * 기본 ObjectMapper로 계약 생성.
     *
     * @param type 변환 대상 타입
     * @param <I> 변환 대상 타입
     * @return 계약
     */
    public static <I> JacksonInputContract<I> of(Class<I> type) {
        return new JacksonInputContract<>(new ObjectMapper(), type);
    }

    @Override
    public I validate(Map<String, Object> raw) {
        if (raw == null) {
            throw new ValidationException("input cannot be null");
        }
        try {
            return mapper.convertValue(raw, type);
        } catch (IllegalArgumentException e) {
            String violation = e.getMessage() == null ? e.getClass().getSimpleName() : firstLine(e.getMessage());
            throw new ValidationException(
                "Input does not match " + type.getSimpleName() + ": " + violation,
                List.of(violation),
                e
            );
        }
    }

    /**
     * 변환 대상 타입 조회.
     *
     * @return 대상 타입
     */
    public Class<I> type() {
        return type;
    }

    private static String firstLine(String message) {
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
