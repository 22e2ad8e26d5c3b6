package com.ryuqq.hustle.runner;

/**
 * 분기 실패 처리 방식.
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public enum FailureMode {

    /**
     * 첫 번째 미복구 오류가 run 전체를 중단 (기본값).
     *
     * <p>오류는 원래 타입 그대로 {@link Hustle#start}에서 전파되며, 큐에 남은 분기는 실행되지 않습니다.</p>
     */
    ABORT_RUN,

    /**
     * 실패한 분기만 종료하고 나머지 분기는 계속 실행.
     *
     * <p>실패는 {@link RunSummary#failures()}에 기록됩니다.
     * InterruptedException과 Error는 이 모드에서도 run을 중단시킵니다.</p>
     */
    CONTAIN_BRANCH
}
