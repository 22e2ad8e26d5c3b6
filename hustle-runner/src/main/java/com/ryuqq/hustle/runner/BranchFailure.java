package com.ryuqq.hustle.runner;

/**
 * CONTAIN_BRANCH 모드에서 격리된 분기 실패.
 *
 * @param unit 실패한 작업 단위 이름
 * @param lineage 실패한 봉투의 계보 태그
 * @param error 원래 오류
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public record BranchFailure(
    String unit,
    String lineage,
    Exception error
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null인 경우
     */
    public BranchFailure {
        if (unit == null) {
            throw new IllegalArgumentException("unit cannot be null");
        }
        if (lineage == null) {
            throw new IllegalArgumentException("lineage cannot be null");
        }
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }
}
