package com.ryuqq.hustle.core.state;

import com.ryuqq.hustle.core.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

/**
 * 기본 Change 복사 전략.
 *
 * <p><strong>복사 규칙:</strong></p>
 * <ul>
 *   <li>불변 JDK 값 (String, 박싱 타입, enum, java.time, UUID, BigDecimal 등): 공유</li>
 *   <li>Map: LinkedHashMap으로 재귀 복사 (SortedMap은 TreeMap, comparator 유지)</li>
 *   <li>List / 기타 Collection: ArrayList로 재귀 복사</li>
 *   <li>Set: LinkedHashSet으로 재귀 복사 (SortedSet은 TreeSet, comparator 유지)</li>
 *   <li>배열: 같은 컴포넌트 타입으로 재귀 복사</li>
 *   <li>순환 참조 / 공유 하위 구조: 복사본에서도 같은 모양으로 유지</li>
 *   <li>{@link Forkable}: fork() 위임</li>
 *   <li>그 외: {@link ConfigurationException} (범용 복제 대신 명시적 소유권 요구)</li>
 * </ul>
 *
 * <p><strong>병합 규칙:</strong></p>
 * <ul>
 *   <li>Map: patch 값을 깊은 복사하여 put (patch에 없는 키는 유지)</li>
 *   <li>{@link Patchable}: patch() 위임</li>
 *   <li>그 외: patch 무시 (WARN 로그)</li>
 * </ul>
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public final class DefaultChangeCopier implements ChangeCopier {

    private static final Logger log = LoggerFactory.getLogger(DefaultChangeCopier.class);

    public static final DefaultChangeCopier INSTANCE = new DefaultChangeCopier();

    private DefaultChangeCopier() {
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T deepCopy(T value) {
        return (T) copyValue(value, new IdentityHashMap<>());
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T applyPatch(T copy, Map<String, Object> patch) {
        if (copy instanceof Map) {
            Map<String, Object> target = (Map<String, Object>) copy;
            Map<Object, Object> copied = new IdentityHashMap<>();
            for (Map.Entry<String, Object> field : patch.entrySet()) {
                target.put(field.getKey(), copyValue(field.getValue(), copied));
            }
            return copy;
        }
        if (copy instanceof Patchable) {
            return ((Patchable<T>) copy).patch(patch);
        }
        log.warn("Patch ignored: change type {} does not support field merge (fields: {})",
            copy == null ? "null" : copy.getClass().getName(), patch.keySet());
        return copy;
    }

    /**
     * 값 하나를 깊은 복사.
     *
     * <p>copied는 원본 → 복사본 identity 매핑입니다. 같은 인스턴스는 한 번만 복사되므로
     * 순환 참조가 종료되고 공유 구조(aliasing)가 복사본에서도 유지됩니다.
     * 컨테이너는 원소를 복사하기 전에 먼저 등록됩니다.</p>
     */
    private Object copyValue(Object value, Map<Object, Object> copied) {
        if (value == null || isImmutable(value)) {
            return value;
        }
        Object existing = copied.get(value);
        if (existing != null) {
            return existing;
        }
        if (value instanceof Forkable) {
            Object fork = ((Forkable<?>) value).fork();
            copied.put(value, fork);
            return fork;
        }
        if (value instanceof Map) {
            return copyMap((Map<?, ?>) value, copied);
        }
        if (value instanceof Set) {
            return copySet((Set<?>) value, copied);
        }
        if (value instanceof Collection) {
            List<Object> copy = new ArrayList<>(((Collection<?>) value).size());
            copied.put(value, copy);
            for (Object element : (Collection<?>) value) {
                copy.add(copyValue(element, copied));
            }
            return copy;
        }
        if (value.getClass().isArray()) {
            return copyArray(value, copied);
        }
        throw new ConfigurationException(
            "Cannot deep-copy change value of type " + value.getClass().getName()
                + ": implement Forkable or use an immutable type"
        );
    }

    @SuppressWarnings("unchecked")
    private Map<Object, Object> copyMap(Map<?, ?> source, Map<Object, Object> copied) {
        Map<Object, Object> copy;
        if (source instanceof SortedMap) {
            copy = new TreeMap<>((Comparator<Object>) ((SortedMap<?, ?>) source).comparator());
        } else {
            copy = new LinkedHashMap<>();
        }
        copied.put(source, copy);
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(copyValue(entry.getKey(), copied), copyValue(entry.getValue(), copied));
        }
        return copy;
    }

    @SuppressWarnings("unchecked")
    private Set<Object> copySet(Set<?> source, Map<Object, Object> copied) {
        Set<Object> copy;
        if (source instanceof SortedSet) {
            copy = new TreeSet<>((Comparator<Object>) ((SortedSet<?>) source).comparator());
        } else {
            copy = new LinkedHashSet<>();
        }
        copied.put(source, copy);
        for (Object element : source) {
            copy.add(copyValue(element, copied));
        }
        return copy;
    }

    private Object copyArray(Object source, Map<Object, Object> copied) {
        Class<?> componentType = source.getClass().getComponentType();
        int length = Array.getLength(source);
        Object copy = Array.newInstance(componentType, length);
        copied.put(source, copy);
        if (componentType.isPrimitive()) {
            System.arraycopy(source, 0, copy, 0, length);
            return copy;
        }
        for (int i = 0; i < length; i++) {
            Array.set(copy, i, copyValue(Array.get(source, i), copied));
        }
        return copy;
    }

    private static boolean isImmutable(Object value) {
        return value instanceof String
            || value instanceof Boolean
            || value instanceof Character
            || value instanceof Byte
            || value instanceof Short
            || value instanceof Integer
            || value instanceof Long
            || value instanceof Float
            || value instanceof Double
            || value instanceof BigDecimal
            || value instanceof BigInteger
            || value instanceof Enum
            || value instanceof UUID
            || value instanceof Class
            || (value instanceof TemporalAccessor && value.getClass().getName().startsWith("java.time."))
            || value instanceof java.time.Duration
            || value instanceof java.time.Period;
    }
}
