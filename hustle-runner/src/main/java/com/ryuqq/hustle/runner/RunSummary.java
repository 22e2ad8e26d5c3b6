package com.ryuqq.hustle.runner;

import java.util.List;

/**
 * 정상 종료된(큐가 빈) run의 요약.
 *
 * <p>run의 실제 결과는 capital에 적용된 변경이며, 이 요약은 실행 통계만 담습니다.</p>
 *
 * @param stepsExecuted 실행한 step 수 (실패한 step 포함)
 * @param branchesTerminated 연결되지 않은 route로 끝난 분기 수
 * @param failures CONTAIN_BRANCH 모드에서 격리된 실패 목록 (ABORT_RUN 모드에서는 항상 비어있음)
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public record RunSummary(
    long stepsExecuted,
    long branchesTerminated,
    List<BranchFailure> failures
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 카운트가 음수인 경우
     */
    public RunSummary {
        if (stepsExecuted < 0) {
            throw new IllegalArgumentException("stepsExecuted must be non-negative (current: " + stepsExecuted + ")");
        }
        if (branchesTerminated < 0) {
            throw new IllegalArgumentException("branchesTerminated must be non-negative (current: " + branchesTerminated + ")");
        }
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    /**
     * 격리된 실패 없이 끝났는지 확인.
     *
     * @return 실패가 없으면 true
     */
    public boolean isClean() {
        return failures.isEmpty();
    }
}
