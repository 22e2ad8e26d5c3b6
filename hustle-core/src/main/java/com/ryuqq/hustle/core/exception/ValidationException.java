package com.ryuqq.hustle.core.exception;

import java.util.List;

/**
 * 입력 계약 위반.
 *
 * <p>작업 단위의 validate 단계에서 발생하며, 재시도되지 않고 즉시 전파됩니다.</p>
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public class ValidationException extends HustleException {

    private final List<String> violations;

    /**
     * 단일 위반으로 생성.
     *
     * @param message 위반 내용
     */
    public ValidationException(String message) {
        this(message, List.of(message), null);
    }

    /**
     * 위반 목록으로 생성.
     *
     * @param message 요약 메시지
     * @param violations 개별 위반 목록
     */
    public ValidationException(String message, List<String> violations) {
        this(message, violations, null);
    }

    /**
     * 원인 예외와 함께 생성 (예: 역직렬화 실패).
     *
     * @param message 요약 메시지
     * @param violations 개별 위반 목록
     * @param cause 원인 (null 가능)
     */
    public ValidationException(String message, List<String> violations, Throwable cause) {
        super(message, cause);
        this.violations = violations == null ? List.of() : List.copyOf(violations);
    }

    /**
     * 개별 위반 목록 조회.
     *
     * @return 불변 위반 목록
     */
    public List<String> violations() {
        return violations;
    }
}
