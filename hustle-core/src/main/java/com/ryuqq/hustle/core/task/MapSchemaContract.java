package com.ryuqq.hustle.core.task;

import com.ryuqq.hustle.core.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 필드 이름과 타입으로 정의하는 Map 입력 계약.
 *
 * <p>모든 위반을 한 번에 수집하여 {@link ValidationException}으로 보고합니다.
 * 검증을 통과하면 입력 Map의 불변 뷰를 반환합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * MapSchemaContract contract = MapSchemaContract.builder()
 *     .required("name", String.class)
 *     .optional("idea", String.class)
 *     .build();
 * </pre>
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public final class MapSchemaContract implements InputContract<Map<String, Object>> {

    private final Map<String, Field> fields;

    private MapSchemaContract(Map<String, Field> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Builder 생성.
     *
     * @return Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Map<String, Object> validate(Map<String, Object> raw) {
        if (raw == null) {
            throw new ValidationException("input cannot be null");
        }

        List<String> violations = new ArrayList<>();
        for (Field field : fields.values()) {
            Object value = raw.get(field.name());
            if (value == null) {
                if (field.required()) {
                    violations.add(field.name() + ": required field is missing");
                }
                continue;
            }
            if (!field.type().isInstance(value)) {
                violations.add(field.name() + ": expected " + field.type().getSimpleName()
                    + " but was " + value.getClass().getSimpleName());
            }
        }

        if (!violations.isEmpty()) {
            throw new ValidationException("Input contract violated: " + violations, violations);
        }
        return Collections.unmodifiableMap(raw);
    }

    private record Field(String name, Class<?> type, boolean required) {
    }

    /**
     * MapSchemaContract Builder.
     */
    public static final class Builder {

        private final Map<String, Field> fields = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 필수 필드 추가.
         *
         * @param name 필드 이름
         * @param type 기대 타입
         * @return this
         */
        public Builder required(String name, Class<?> type) {
            return add(name, type, true);
        }

        /**
         * 선택 필드 추가 (존재하면 타입 검증).
         *
         * @param name 필드 이름
         * @param type 기대 타입
         * @return this
         */
        public Builder optional(String name, Class<?> type) {
            return add(name, type, false);
        }

        private Builder add(String name, Class<?> type, boolean required) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("field name cannot be null or blank");
            }
            if (type == null) {
                throw new IllegalArgumentException("field type cannot be null");
            }
            fields.put(name, new Field(name, type, required));
            return this;
        }

        /**
         * 계약 생성.
         *
         * @return MapSchemaContract 인스턴스
         */
        public MapSchemaContract build() {
            return new MapSchemaContract(fields);
        }
    }
}
