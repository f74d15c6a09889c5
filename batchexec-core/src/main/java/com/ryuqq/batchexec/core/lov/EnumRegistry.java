package com.ryuqq.batchexec.core.lov;

import com.ryuqq.batchexec.core.attribute.AttributeRegistry;
import com.ryuqq.batchexec.core.attribute.Attributed;
import com.ryuqq.batchexec.core.exception.SyntaxException;
import com.ryuqq.batchexec.core.exception.UnknownAttributeException;
import com.ryuqq.batchexec.core.exception.UnknownClassException;
import com.ryuqq.batchexec.core.exception.UnknownKeyException;
import com.ryuqq.batchexec.core.spi.EnumStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * LoV (List of Values) 레지스트리.
 *
 * <p>모든 호스트 객체가 공유하는 {@link EnumStore} 위에서 클래스 단위 유효 값 집합을
 * 등록, 조회, 검증하고, 그 값을 대상 객체의 속성에 할당합니다.</p>
 *
 * <p><strong>연산:</strong></p>
 * <ul>
 *   <li>register: 클래스 등록 또는 기존 클래스에 병합 (겹치는 키는 기존 설명 유지)</li>
 *   <li>clear: 클래스 삭제, 삭제 직전 항목 수 반환</li>
 *   <li>keys / lookup: 조회</li>
 *   <li>random: 무작위 키를 대상 속성에 설정</li>
 *   <li>conditionalDefault: 대상 속성이 미설정(null)일 때만 설정</li>
 *   <li>forceSet: 무조건 설정</li>
 * </ul>
 *
 * <p><strong>검증 순서 (random, conditionalDefault, forceSet):</strong></p>
 * <pre>
 * 1. 인자 누락 → SyntaxException
 * 2. 대상 속성 없음 → UnknownAttributeException
 * 3. 클래스 미등록 → UnknownClassException
 * 4. 값이 클래스 멤버가 아님 → UnknownKeyException
 * 5. AttributeRegistry.set (읽기 전용이면 ReadOnlyViolationException)
 * </pre>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * EnumRegistry lov = new EnumRegistry(new InMemoryEnumStore(), ShuffleChooser.shared());
 * lov.register("color", Map.of("red", "desc r", "blue", "desc b"));
 *
 * lov.keys("color");                                  // [blue, red]
 * lov.conditionalDefault("color", host, "state", "blue");
 * lov.random("color", host, "state");
 * }</pre>
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public final class EnumRegistry {

    private static final Logger log = LoggerFactory.getLogger(EnumRegistry.class);

    private final EnumStore store;
    private final Chooser chooser;

    /**
     * 생성자.
     *
     * @param store 공유 저장소
     * @param chooser 무작위 선택 전략
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public EnumRegistry(EnumStore store, Chooser chooser) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (chooser == null) {
            throw new IllegalArgumentException("chooser cannot be null");
        }
        this.store = store;
        this.chooser = chooser;
    }

    /**
     * 클래스 등록 또는 병합.
     *
     * @param enumClass 클래스 이름
     * @param entries 키 → 설명
     * @return 등록 후 항목 수
     * @throws SyntaxException 인자가 누락되었거나 매핑에 null 키가 있는 경우
     */
    public int register(String enumClass, Map<String, String> entries) {
        requireClass(enumClass, "register");
        if (entries == null) {
            throw new SyntaxException("register(" + enumClass + ") must pass a key/description mapping");
        }
        for (String key : entries.keySet()) {
            if (key == null) {
                throw new SyntaxException("register(" + enumClass + ") mapping cannot contain an undefined key");
            }
        }

        boolean merging = store.find(enumClass).isPresent();
        int count = store.register(enumClass, entries);
        log.info("{} {} ({} entries)", merging ? "merging" : "registering", enumClass, count);
        return count;
    }

    /**
     * 클래스 삭제.
     *
     * @param enumClass 클래스 이름
     * @return 삭제 직전 항목 수 (등록된 적 없으면 0)
     * @throws SyntaxException 인자가 누락된 경우
     */
    public int clear(String enumClass) {
        requireClass(enumClass, "clear");
        int count = store.clear(enumClass);
        log.debug("cleared {} ({} entries)", enumClass, count);
        return count;
    }

    /**
     * 정렬된 키 목록.
     *
     * @param enumClass 클래스 이름
     * @return 정렬된 키
     * @throws UnknownClassException 등록되지 않은 클래스인 경우
     */
    public List<String> keys(String enumClass) {
        return require(enumClass, "keys").keys();
    }

    /**
     * 키의 설명 조회.
     *
     * @param enumClass 클래스 이름
     * @param key 키
     * @return 설명
     * @throws UnknownClassException 등록되지 않은 클래스인 경우
     * @throws UnknownKeyException 키가 없는 경우
     */
    public String lookup(String enumClass, String key) {
        EnumClass lov = require(enumClass, "lookup");
        if (key == null) {
            throw new SyntaxException("lookup(" + enumClass + ", KEY) must specify a key");
        }
        validate(lov, key);
        log.trace("lookup {} [{}]", enumClass, key);
        return lov.description(key);
    }

    /**
     * 멤버 여부 확인. 실패하지 않습니다.
     *
     * @param enumClass 클래스 이름
     * @param key 키
     * @return 클래스가 등록되어 있고 키를 포함하면 true
     */
    public boolean isMember(String enumClass, String key) {
        if (enumClass == null || key == null) {
            return false;
        }
        return store.find(enumClass).map(lov -> lov.contains(key)).orElse(false);
    }

    /**
     * 무작위 키를 대상 속성에 설정.
     *
     * @param enumClass 클래스 이름
     * @param target 대상 객체
     * @param attribute 속성 이름
     * @return 설정된 값
     * @throws UnknownClassException 등록되지 않은 클래스인 경우
     * @throws UnknownKeyException 클래스에 멤버가 없는 경우
     */
    public Object random(String enumClass, Attributed target, String attribute) {
        AttributeRegistry attributes = requireTarget(enumClass, target, attribute, "random");
        EnumClass lov = require(enumClass, "random");
        if (lov.size() == 0) {
            throw new UnknownKeyException(enumClass, "(any)", lov.keys());
        }

        String value = chooser.chooseOne(lov.keys());
        validate(lov, value);
        log.info("randomising attribute [{}] to [{}]", attribute, value);
        return attributes.set(attribute, value);
    }

    /**
     * 대상 속성이 미설정(null)일 때만 설정.
     *
     * @param enumClass 클래스 이름
     * @param target 대상 객체
     * @param attribute 속성 이름
     * @param key 설정할 키
     * @return 설정 후(또는 기존) 속성 값
     * @throws UnknownClassException 등록되지 않은 클래스인 경우
     * @throws UnknownKeyException key가 멤버가 아닌 경우
     */
    public Object conditionalDefault(String enumClass, Attributed target, String attribute, String key) {
        AttributeRegistry attributes = requireTarget(enumClass, target, attribute, "conditionalDefault");
        validate(require(enumClass, "conditionalDefault"), requireKey(enumClass, key, "conditionalDefault"));

        Object current = attributes.get(attribute);
        if (current != null) {
            log.info("skipping attribute default for [{}]", attribute);
            return current;
        }
        log.info("defaulting attribute [{}] to [{}]", attribute, key);
        return attributes.set(attribute, key);
    }

    /**
     * 멤버 검증 후 무조건 설정.
     *
     * @param enumClass 클래스 이름
     * @param target 대상 객체
     * @param attribute 속성 이름
     * @param key 설정할 키
     * @return 설정된 값
     * @throws UnknownClassException 등록되지 않은 클래스인 경우
     * @throws UnknownKeyException key가 멤버가 아닌 경우
     */
    public Object forceSet(String enumClass, Attributed target, String attribute, String key) {
        AttributeRegistry attributes = requireTarget(enumClass, target, attribute, "forceSet");
        validate(require(enumClass, "forceSet"), requireKey(enumClass, key, "forceSet"));

        log.info("setting [{}] to [{}]", attribute, key);
        return attributes.set(attribute, key);
    }

    private EnumClass require(String enumClass, String action) {
        requireClass(enumClass, action);
        return store.find(enumClass)
            .orElseThrow(() -> new UnknownClassException("no such LoV exists [" + enumClass + "]"));
    }

    private static void requireClass(String enumClass, String action) {
        if (enumClass == null) {
            throw new SyntaxException(action + "(CLASS) must specify a class");
        }
    }

    private static String requireKey(String enumClass, String key, String action) {
        if (key == null) {
            throw new SyntaxException(action + "(" + enumClass + ", OBJ, ATTR, VALUE) must specify a value");
        }
        return key;
    }

    private static AttributeRegistry requireTarget(String enumClass, Attributed target, String attribute, String action) {
        requireClass(enumClass, action);
        if (target == null || attribute == null) {
            throw new SyntaxException(action + "(" + enumClass + ", OBJ, ATTR) must specify an object and attribute");
        }
        AttributeRegistry attributes = target.attributes();
        if (!attributes.has(attribute)) {
            throw new UnknownAttributeException(attribute);
        }
        return attributes;
    }

    private static void validate(EnumClass lov, String value) {
        if (!lov.contains(value)) {
            throw new UnknownKeyException(lov.name(), value, lov.keys());
        }
    }
}
