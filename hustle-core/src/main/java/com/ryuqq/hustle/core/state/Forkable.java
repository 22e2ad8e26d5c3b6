package com.ryuqq.hustle.core.state;

/**
 * 스스로 독립 복사본을 만들 수 있는 구조화 change 값.
 *
 * <p>{@link DefaultChangeCopier}는 Map/List/Set/배열과 불변 JDK 값 외의 타입에 대해
 * 범용 깊은 복사를 시도하지 않고 이 인터페이스를 요구합니다.
 * 복제할 수 없는 자원(커넥션, 핸들)을 담은 타입은 fork()에서 소유권 이전 방식을 직접 정의해야 합니다.</p>
 *
 * @param <T> 자기 자신 타입
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public interface Forkable<T> {

    /**
     * 원본과 가변 하위 구조를 공유하지 않는 복사본 생성.
     *
     * @return 독립 복사본
     */
    T fork();
}
