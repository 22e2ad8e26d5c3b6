package com.ryuqq.hustle.core.exception;

/**
 * 그래프 구성 오류.
 *
 * <p>null 후속 단위 연결, 선언되지 않은 route 연결, 진입 단위 없는 스케줄러 생성 등
 * 실행 전(그래프 구성 시점)에 발생합니다.</p>
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public class RoutingException extends HustleException {

    public RoutingException(String message) {
        super(message);
    }
}
