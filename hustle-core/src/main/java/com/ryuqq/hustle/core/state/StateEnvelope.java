package com.ryuqq.hustle.core.state;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 작업 단위 사이를 오가는 상태 봉투 (docking station).
 *
 * <p>StateEnvelope은 두 가지 상태 영역과 계보(lineage) 태그를 담습니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>capital:</strong> run 전체와 모든 분기가 참조로 공유하는 상태 (복사하지 않음)</li>
 *   <li><strong>change:</strong> 분기별 상태, fork 시마다 깊은 복사</li>
 *   <li><strong>lineage:</strong> 봉투의 파생 경로 (예: root/forward-1/approve-3)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>봉투 자체는 생성 후 변경되지 않음 (fork는 새 봉투를 반환)</li>
 *   <li>하나의 root에서 파생된 모든 봉투는 같은 capital 인스턴스를 가짐</li>
 *   <li>fork된 change와 원본 change는 서로 독립적</li>
 *   <li>lineage는 fork마다 고유 접미사가 붙어 run 내에서 중복되지 않음</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * StateEnvelope&lt;Firm, Map&lt;String, Object&gt;&gt; root = StateEnvelope.create(firm, change);
 * StateEnvelope&lt;Firm, Map&lt;String, Object&gt;&gt; branch = root.fork(Map.of("decision", "FUND"));
 *
 * branch.capital() == root.capital();   // true
 * branch.change() == root.change();     // false
 * </pre>
 *
 * @param <C> capital 타입
 * @param <T> change 타입
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public final class StateEnvelope<C, T> {

    public static final String ROOT_TAG = "root";

    private static final String DEFAULT_FORK_LABEL = "fork";

    private final C capital;
    private final T change;
    private final String lineage;
    private final ChangeCopier copier;
    private final AtomicLong forkSequence;

    private StateEnvelope(C capital, T change, String lineage, ChangeCopier copier, AtomicLong forkSequence) {
        this.capital = capital;
        this.change = change;
        this.lineage = lineage;
        this.copier = copier;
        this.forkSequence = forkSequence;
    }

    /**
     * root 봉투 생성 (태그 "root", 기본 복사 전략).
     *
     * @param capital 공유 상태
     * @param change 분기 상태 (null 가능)
     * @param <C> capital 타입
     * @param <T> change 타입
     * @return root 봉투
     */
    public static <C, T> StateEnvelope<C, T> create(C capital, T change) {
        return create(capital, change, ROOT_TAG, DefaultChangeCopier.INSTANCE);
    }

    /**
     * root 봉투 생성 (태그 지정).
     *
     * @param capital 공유 상태
     * @param change 분기 상태 (null 가능)
     * @param tag 계보 시작 태그
     * @param <C> capital 타입
     * @param <T> change 타입
     * @return root 봉투
     */
    public static <C, T> StateEnvelope<C, T> create(C capital, T change, String tag) {
        return create(capital, change, tag, DefaultChangeCopier.INSTANCE);
    }

    /**
     * root 봉투 생성 (태그, 복사 전략 지정).
     *
     * @param capital 공유 상태
     * @param change 분기 상태 (null 가능)
     * @param tag 계보 시작 태그
     * @param copier change 복사 전략
     * @param <C> capital 타입
     * @param <T> change 타입
     * @return root 봉투
     * @throws IllegalArgumentException tag가 비어있거나 copier가 null인 경우
     */
    public static <C, T> StateEnvelope<C, T> create(C capital, T change, String tag, ChangeCopier copier) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("tag cannot be null or blank");
        }
        if (copier == null) {
            throw new IllegalArgumentException("copier cannot be null");
        }
        return new StateEnvelope<>(capital, change, tag, copier, new AtomicLong());
    }

    /**
     * patch 없이 fork.
     *
     * @return 새 봉투
     */
    public StateEnvelope<C, T> fork() {
        return fork(DEFAULT_FORK_LABEL, null);
    }

    /**
     * patch를 병합하여 fork.
     *
     * @param patch 병합할 필드 (null 또는 빈 Map이면 병합 없음)
     * @return 새 봉투
     */
    public StateEnvelope<C, T> fork(Map<String, Object> patch) {
        return fork(DEFAULT_FORK_LABEL, patch);
    }

    /**
     * 라벨과 patch를 지정하여 fork (undock).
     *
     * <p><strong>처리 순서:</strong></p>
     * <ol>
     *   <li>change 깊은 복사</li>
     *   <li>patch가 있고 change 표현이 필드 병합을 지원하면 복사본에 병합</li>
     *   <li>capital은 참조 그대로 전달</li>
     *   <li>lineage = 현재 lineage + "/" + label + "-" + run 내 일련번호</li>
     * </ol>
     *
     * @param label lineage 접미사 라벨 (보통 route 이름)
     * @param patch 병합할 필드 (null 가능)
     * @return 새 봉투
     * @throws IllegalArgumentException label이 비어있는 경우
     * @throws com.ryuqq.hustle.core.exception.ConfigurationException change를 복사할 수 없는 경우
     */
    public StateEnvelope<C, T> fork(String label, Map<String, Object> patch) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label cannot be null or blank");
        }

        T copied = copier.deepCopy(change);
        if (patch != null && !patch.isEmpty()) {
            copied = copier.applyPatch(copied, patch);
        }

        String childLineage = lineage + "/" + label + "-" + forkSequence.incrementAndGet();
        return new StateEnvelope<>(capital, copied, childLineage, copier, forkSequence);
    }

    /**
     * 공유 상태 조회.
     *
     * @return capital
     */
    public C capital() {
        return capital;
    }

    /**
     * 분기 상태 조회.
     *
     * @return change (null 가능)
     */
    public T change() {
        return change;
    }

    /**
     * 계보 태그 조회.
     *
     * @return lineage
     */
    public String lineage() {
        return lineage;
    }

    @Override
    public String toString() {
        return "StateEnvelope{lineage=" + lineage + ", change=" + change + '}';
    }
}
