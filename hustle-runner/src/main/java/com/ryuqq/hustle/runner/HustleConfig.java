package com.ryuqq.hustle.runner;

import com.ryuqq.hustle.core.exception.ConfigurationException;

/**
 * Hustle 스케줄러 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>failureMode: 분기 실패 처리 방식 (기본 ABORT_RUN)</li>
 *   <li>maxSteps: run 하나에서 실행할 최대 step 수 (기본 0 = 무제한).
 *       순환 그래프의 무한 실행을 막는 안전장치입니다.</li>
 * </ul>
 *
 * @author Hustle Team
 * @since 1.0.0
 * @param failureMode 분기 실패 처리 방식
 * @param maxSteps 최대 step 수 (0 이상, 0은 무제한)
 */
public record HustleConfig(
    FailureMode failureMode,
    long maxSteps
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: failureMode=ABORT_RUN, maxSteps=0 (무제한)</p>
     */
    public HustleConfig() {
        this(FailureMode.ABORT_RUN, 0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws ConfigurationException 파라미터 검증 실패 시
     */
    public HustleConfig {
        if (failureMode == null) {
            throw new ConfigurationException("failureMode cannot be null");
        }
        if (maxSteps < 0) {
            throw new ConfigurationException(
                "maxSteps must be non-negative (current: " + maxSteps + ")"
            );
        }
    }

    /**
     * failureMode만 변경한 새 인스턴스 생성.
     */
    public HustleConfig withFailureMode(FailureMode failureMode) {
        return new HustleConfig(failureMode, maxSteps);
    }

    /**
     * maxSteps만 변경한 새 인스턴스 생성.
     */
    public HustleConfig withMaxSteps(long maxSteps) {
        return new HustleConfig(failureMode, maxSteps);
    }

    /**
     * step 수 제한 여부.
     *
     * @return maxSteps가 0보다 크면 true
     */
    public boolean isStepLimited() {
        return maxSteps > 0;
    }
}
