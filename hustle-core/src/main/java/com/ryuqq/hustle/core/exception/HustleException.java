package com.ryuqq.hustle.core.exception;

/**
 * Hustle 엔진이 직접 발생시키는 예외의 공통 상위 타입.
 *
 * <p>작업 단위의 execute 단계에서 발생한 예외는 이 계층에 속하지 않으며,
 * 원래 타입 그대로 호출자에게 전달됩니다.</p>
 *
 * <ul>
 *   <li>{@link ValidationException} - 입력 계약 위반 (재시도 불가)</li>
 *   <li>{@link RoutingException} - 그래프 구성 오류</li>
 *   <li>{@link ConfigurationException} - 잘못된 정책 설정</li>
 * </ul>
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public class HustleException extends RuntimeException {

    public HustleException(String message) {
        super(message);
    }

    public HustleException(String message, Throwable cause) {
        super(message, cause);
    }
}
