package com.ryuqq.hustle.adapter.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.hustle.core.exception.ConfigurationException;
import com.ryuqq.hustle.core.state.ChangeCopier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Jackson tree 기반 Change 복사 전략.
 *
 * <p>값을 JsonNode로 직렬화한 뒤 같은 타입으로 다시 읽어 깊은 복사합니다.
 * Forkable을 구현하지 않은 record/POJO change에 사용합니다.</p>
 *
 * <p><strong>병합:</strong> 값이 JSON 객체로 직렬화되면 patch 필드를 최상위에 덮어쓴 뒤
 * 다시 역직렬화합니다. 배열/스칼라로 직렬화되는 값은 patch를 무시합니다 (WARN 로그).</p>
 *
 * <p>복사 결과 타입은 값의 런타임 클래스이므로, 역직렬화 가능한 타입이어야 합니다.
 * 생성할 수 없는 JDK 불변 컬렉션은 가변 기본 구현으로 복사됩니다.</p>
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public final class JacksonChangeCopier implements ChangeCopier {

    private static final Logger log = LoggerFactory.getLogger(JacksonChangeCopier.class);

    private final ObjectMapper mapper;

    /**
     * 기본 ObjectMapper로 생성.
     */
    public JacksonChangeCopier() {
        this(new ObjectMapper());
    }

    /**
     * 생성자.
     *
     * @param mapper ObjectMapper
     * @throws IllegalArgumentException mapper가 null인 경우
     */
    public JacksonChangeCopier(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    @Override
    public <T> T deepCopy(T value) {
        if (value == null) {
            return null;
        }
        return readAs(toTree(value), value);
    }

    @Override
    public <T> T applyPatch(T copy, Map<String, Object> patch) {
        if (copy == null || patch == null || patch.isEmpty()) {
            return copy;
        }
        JsonNode tree = toTree(copy);
        if (!tree.isObject()) {
            log.warn("Ignoring patch {} for non-object change of type {}", patch.keySet(), copy.getClass().getName());
            return copy;
        }
        ObjectNode merged = (ObjectNode) tree;
        merged.setAll((ObjectNode) mapper.valueToTree(patch));
        return readAs(merged, copy);
    }

    private JsonNode toTree(Object value) {
        try {
            return mapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(
                "Cannot serialize change of type " + value.getClass().getName(), e
            );
        }
    }

    @SuppressWarnings("unchecked")
    private <T> T readAs(JsonNode tree, T template) {
        Class<T> type = (Class<T>) targetType(template);
        try {
            return mapper.treeToValue(tree, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ConfigurationException(
                "Cannot deserialize change of type " + type.getName(), e
            );
        }
    }

    /**
     * 역직렬화 대상 타입 결정.
     *
     * <p>Map/Collection 중 public 기본 생성자가 없는 구현 (Map.of, List.of,
     * Collections.unmodifiableX 등)은 LinkedHashMap / LinkedHashSet / ArrayList로 대체합니다.</p>
     */
    private static Class<?> targetType(Object template) {
        Class<?> type = template.getClass();
        if (!(template instanceof Map) && !(template instanceof Collection)) {
            return type;
        }
        if (hasPublicNoArgConstructor(type)) {
            return type;
        }
        if (template instanceof Map) {
            return LinkedHashMap.class;
        }
        if (template instanceof Set) {
            return LinkedHashSet.class;
        }
        return ArrayList.class;
    }

    private static boolean hasPublicNoArgConstructor(Class<?> type) {
        if (!Modifier.isPublic(type.getModifiers()) || Modifier.isAbstract(type.getModifiers())) {
            return false;
        }
        for (Constructor<?> constructor : type.getConstructors()) {
            if (constructor.getParameterCount() == 0) {
                return true;
            }
        }
        return false;
    }
}
