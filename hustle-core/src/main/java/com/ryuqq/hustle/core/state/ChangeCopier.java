package com.ryuqq.hustle.core.state;

import java.util.Map;

/**
 * Change 복사/병합 전략 SPI.
 *
 * <p>StateEnvelope은 fork 시 이 전략으로 change를 깊은 복사하고 patch를 병합합니다.</p>
 *
 * <p><strong>구현 지침:</strong></p>
 * <ul>
 *   <li>deepCopy 결과는 원본과 어떤 가변 하위 구조도 공유하지 않아야 합니다.</li>
 *   <li>applyPatch는 deepCopy 결과에만 호출되므로 인자를 직접 변경해도 됩니다.</li>
 *   <li>필드 병합을 지원하지 않는 표현이면 applyPatch는 입력을 그대로 반환합니다.</li>
 * </ul>
 *
 * @author Hustle Team
 * @since 1.0.0
 * @see DefaultChangeCopier
 */
public interface ChangeCopier {

    /**
     * 깊은 복사.
     *
     * @param value 원본 (null 가능)
     * @param <T> 값 타입
     * @return 독립 복사본 (원본이 null이면 null)
     * @throws com.ryuqq.hustle.core.exception.ConfigurationException 복사할 수 없는 타입인 경우
     */
    <T> T deepCopy(T value);

    /**
     * 복사본에 patch 병합.
     *
     * @param copy deepCopy 결과
     * @param patch 병합할 필드 (비어있지 않음)
     * @param <T> 값 타입
     * @return 병합된 값
     */
    <T> T applyPatch(T copy, Map<String, Object> patch);
}
