package com.ryuqq.batchexec.core.attribute;

import com.ryuqq.batchexec.core.exception.DuplicateAttributeException;
import com.ryuqq.batchexec.core.exception.InvalidKindException;
import com.ryuqq.batchexec.core.exception.ReadOnlyViolationException;
import com.ryuqq.batchexec.core.exception.SyntaxException;
import com.ryuqq.batchexec.core.exception.UnknownAttributeException;
import com.ryuqq.batchexec.core.support.Tabulator;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 객체 단위의 타입 지정 속성 저장소.
 *
 * <p>이름으로 조회되는 속성마다 kind, 현재 값, 기본값, 읽기 전용 여부를 보관하며,
 * 컴파일된 접근자 대신 하나의 범용 get/set 경로로 늦게 바인딩된 이름을 지원합니다.</p>
 *
 * <p><strong>원자성:</strong> 모든 연산은 사전 조건을 먼저 검증하고, 위반 시 어떤 상태도
 * 변경하지 않은 채 즉시 예외를 던집니다. 여러 이름을 받는 연산은 모든 이름을 검증한 뒤에만
 * 변경을 적용합니다.</p>
 *
 * <p><strong>연산 요약:</strong></p>
 * <ul>
 *   <li>define: 새 속성 생성 (중복 시 실패)</li>
 *   <li>get / defaultValue / prop: 조회</li>
 *   <li>set: 현재 값 (및 기본값) 변경, 읽기 전용이면 실패</li>
 *   <li>reset / sync: 값과 기본값 사이 복사, 읽기 전용 무시</li>
 *   <li>ro / rw: 읽기 전용 토글</li>
 *   <li>remove: 속성 삭제 후 스냅샷 반환</li>
 *   <li>list: 공개 속성 이름 목록 (verbose 시 표 출력)</li>
 * </ul>
 *
 * <p><strong>스레드 안전성:</strong> 객체별 상태이므로 동기화하지 않습니다.
 * 하나의 객체를 여러 스레드가 공유하는 경우 호출자가 동기화해야 합니다.</p>
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public final class AttributeRegistry {

    /**
     * reset, sync, ro, rw에서 정의된 모든 속성을 가리키는 이름.
     */
    public static final String ALL = "(all)";

    private static final int DISPLAY_WIDTH = 30;

    private final String ownerClass;
    private final Logger log;
    private final Tabulator tabulator;
    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private List<String> inheritable = List.of();

    /**
     * 생성자.
     *
     * @param ownerClass 속성을 정의하는 타입 이름 (진단용)
     * @param log 로깅 협력자 (OPAQUE_HANDLE 속성의 기본 핸들로도 사용)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public AttributeRegistry(String ownerClass, Logger log) {
        if (ownerClass == null || ownerClass.isBlank()) {
            throw new IllegalArgumentException("ownerClass cannot be null or blank");
        }
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        this.ownerClass = ownerClass;
        this.log = log;
        this.tabulator = new Tabulator(log, DISPLAY_WIDTH);
    }

    /**
     * 기본값 없이 속성 정의.
     *
     * @param name 속성 이름
     * @param kind 값의 종류
     * @param value 초기 값
     * @return 생성된 속성의 스냅샷
     * @see #define(String, AttributeKind, Object, Object)
     */
    public AttributeDescriptor define(String name, AttributeKind kind, Object value) {
        return define(name, kind, value, null);
    }

    /**
     * 새 속성 정의.
     *
     * <p>BOOLEAN 속성은 값과 기본값을 각각 0 또는 1로 정규화합니다.
     * 정의되지 않은 값(null)은 경고와 함께 0이 됩니다.
     * OPAQUE_HANDLE 속성에 null을 넘기면 이 레지스트리의 로거가 핸들로 바인딩됩니다.</p>
     *
     * @param name 속성 이름
     * @param kind 값의 종류
     * @param value 초기 값 (null 가능)
     * @param defaultValue 기본값 (null 가능)
     * @return 생성된 속성의 스냅샷
     * @throws SyntaxException name 또는 kind가 누락된 경우
     * @throws DuplicateAttributeException 이미 같은 이름의 속성이 있는 경우
     * @throws InvalidKindException BOOLEAN 제약 위반인 경우
     */
    public AttributeDescriptor define(String name, AttributeKind kind, Object value, Object defaultValue) {
        requireName(name, "define");
        if (kind == null) {
            throw new SyntaxException("define operation must specify a type");
        }
        if (entries.containsKey(name)) {
            throw new DuplicateAttributeException("attribute [" + name + "] already exists");
        }

        Object initial;
        Object fallback;
        if (kind == AttributeKind.OPAQUE_HANDLE) {
            initial = value != null ? value : log;
            fallback = initial;
        } else {
            initial = checkBoolean(name, kind, value);
            fallback = checkBoolean(name, kind, defaultValue);
        }

        Entry entry = new Entry(name, kind, initial, fallback);
        entries.put(name, entry);
        log.trace("defined attribute [{}] kind [{}]", name, kind.getTag());

        return entry.snapshot();
    }

    /**
     * 현재 값 조회.
     *
     * @param name 속성 이름
     * @return 현재 값 (미설정이면 null)
     * @throws UnknownAttributeException 정의되지 않은 속성인 경우
     */
    public Object get(String name) {
        return require(name).value;
    }

    /**
     * 현재 값을 지정한 타입으로 조회.
     *
     * @param name 속성 이름
     * @param type 기대 타입
     * @param <T> 기대 타입
     * @return 현재 값 (미설정이면 null)
     * @throws UnknownAttributeException 정의되지 않은 속성인 경우
     * @throws ClassCastException 값이 기대 타입이 아닌 경우
     */
    public <T> T get(String name, Class<T> type) {
        return type.cast(get(name));
    }

    /**
     * 현재 값이 참인지 확인.
     *
     * @param name 속성 이름
     * @return 값이 1(또는 0이 아닌 숫자)이거나 Boolean.TRUE이면 true
     * @throws UnknownAttributeException 정의되지 않은 속성인 경우
     */
    public boolean isTrue(String name) {
        Object value = get(name);
        if (value instanceof Number number) {
            return number.intValue() != 0;
        }
        return Boolean.TRUE.equals(value);
    }

    /**
     * 현재 값 변경.
     *
     * @param name 속성 이름
     * @param value 새 값
     * @return 저장된 값
     * @see #set(String, Object, Object)
     */
    public Object set(String name, Object value) {
        return set(name, value, null);
    }

    /**
     * 현재 값과 (지정된 경우) 기본값 변경.
     *
     * @param name 속성 이름
     * @param value 새 값
     * @param defaultValue 새 기본값 (null이면 기본값 유지)
     * @return 저장된 값 (BOOLEAN은 정규화된 값)
     * @throws UnknownAttributeException 정의되지 않은 속성인 경우
     * @throws ReadOnlyViolationException 읽기 전용 속성인 경우
     * @throws InvalidKindException BOOLEAN 제약 위반인 경우
     */
    public Object set(String name, Object value, Object defaultValue) {
        Entry entry = require(name);
        if (entry.readOnly) {
            throw new ReadOnlyViolationException("attribute [" + name + "] is read-only");
        }

        Object checked = checkBoolean(name, entry.kind, value);
        Object checkedDefault = defaultValue != null ? checkBoolean(name, entry.kind, defaultValue) : null;

        entry.value = checked;
        if (checkedDefault != null) {
            entry.defaultValue = checkedDefault;
        }
        return checked;
    }

    /**
     * 값을 저장하지 않고 속성의 kind 제약만 검증.
     *
     * <p>일괄 기록 전에 모든 값을 미리 정규화할 때 사용합니다.
     * 읽기 전용 여부는 검사하지 않습니다.</p>
     *
     * @param name 속성 이름
     * @param value 검증할 값
     * @return 정규화된 값 (BOOLEAN은 0 또는 1)
     * @throws UnknownAttributeException 정의되지 않은 속성인 경우
     * @throws InvalidKindException BOOLEAN 제약 위반인 경우
     */
    public Object check(String name, Object value) {
        Entry entry = require(name);
        return checkBoolean(name, entry.kind, value);
    }

    /**
     * 기본값 조회 (변경 없음).
     *
     * @param name 속성 이름
     * @return 기본값 (null 가능)
     * @throws UnknownAttributeException 정의되지 않은 속성인 경우
     */
    public Object defaultValue(String name) {
        return require(name).defaultValue;
    }

    /**
     * 현재 값을 기본값으로 되돌림.
     *
     * <p>읽기 전용 여부와 관계없이 적용됩니다.</p>
     *
     * @param name 속성 이름 또는 {@link #ALL}
     * @param more 추가 속성 이름
     * @return 처리한 속성 수
     * @throws UnknownAttributeException 정의되지 않은 이름이 포함된 경우 (아무것도 변경되지 않음)
     */
    public int reset(String name, String... more) {
        List<Entry> targets = resolve("reset", name, more);
        targets.forEach(entry -> entry.value = entry.defaultValue);
        return targets.size();
    }

    /**
     * 기본값을 현재 값으로 맞춤.
     *
     * <p>읽기 전용 여부와 관계없이 적용됩니다.</p>
     *
     * @param name 속성 이름 또는 {@link #ALL}
     * @param more 추가 속성 이름
     * @return 처리한 속성 수
     * @throws UnknownAttributeException 정의되지 않은 이름이 포함된 경우 (아무것도 변경되지 않음)
     */
    public int sync(String name, String... more) {
        List<Entry> targets = resolve("sync", name, more);
        targets.forEach(entry -> entry.defaultValue = entry.value);
        return targets.size();
    }

    /**
     * 읽기 전용으로 전환 (멱등).
     *
     * @param name 속성 이름 또는 {@link #ALL}
     * @param more 추가 속성 이름
     * @return 처리한 속성 수 (이미 읽기 전용인 속성 포함)
     * @throws UnknownAttributeException 정의되지 않은 이름이 포함된 경우 (아무것도 변경되지 않음)
     */
    public int ro(String name, String... more) {
        List<Entry> targets = resolve("ro", name, more);
        targets.forEach(entry -> entry.readOnly = true);
        return targets.size();
    }

    /**
     * 읽기/쓰기로 전환 (멱등).
     *
     * @param name 속성 이름 또는 {@link #ALL}
     * @param more 추가 속성 이름
     * @return 처리한 속성 수 (이미 쓰기 가능한 속성 포함)
     * @throws UnknownAttributeException 정의되지 않은 이름이 포함된 경우 (아무것도 변경되지 않음)
     */
    public int rw(String name, String... more) {
        List<Entry> targets = resolve("rw", name, more);
        targets.forEach(entry -> entry.readOnly = false);
        return targets.size();
    }

    /**
     * 메타데이터 필드 하나 조회.
     *
     * @param name 속성 이름
     * @param property 조회할 필드
     * @return 필드 값
     * @throws UnknownAttributeException 정의되지 않은 속성인 경우
     * @throws SyntaxException property가 null인 경우
     */
    public Object prop(String name, AttributeProperty property) {
        Entry entry = require(name);
        if (property == null) {
            throw new SyntaxException("specify a property for attribute [" + name + "]");
        }
        return property.extract(entry.snapshot());
    }

    /**
     * 필드 이름으로 메타데이터 조회.
     *
     * @param name 속성 이름
     * @param field 필드 이름 (ownerClass, default, name, readOnly, kind, value 또는 별칭)
     * @return 필드 값
     * @throws UnknownAttributeException 정의되지 않은 속성인 경우
     * @throws SyntaxException 알 수 없는 필드인 경우
     */
    public Object prop(String name, String field) {
        require(name);
        return prop(name, AttributeProperty.fromName(field));
    }

    /**
     * 속성 삭제.
     *
     * <p>상속 대상 목록에서도 함께 제거됩니다.</p>
     *
     * @param name 속성 이름
     * @return 삭제 직전 스냅샷
     * @throws UnknownAttributeException 정의되지 않은 속성인 경우
     */
    public AttributeDescriptor remove(String name) {
        Entry entry = require(name);
        entries.remove(name);
        if (inheritable.contains(name)) {
            List<String> remaining = new ArrayList<>(inheritable);
            remaining.remove(name);
            inheritable = Collections.unmodifiableList(remaining);
        }
        log.debug("removed attribute [{}]", name);
        return entry.snapshot();
    }

    /**
     * 속성 스냅샷 조회.
     *
     * @param name 속성 이름
     * @return 현재 스냅샷
     * @throws UnknownAttributeException 정의되지 않은 속성인 경우
     */
    public AttributeDescriptor describe(String name) {
        return require(name).snapshot();
    }

    /**
     * 속성 존재 여부. 실패하지 않습니다.
     *
     * @param name 속성 이름
     * @return 정의되어 있으면 true
     */
    public boolean has(String name) {
        return name != null && entries.containsKey(name);
    }

    /**
     * 공개 속성 이름 목록.
     *
     * @return 정렬된 공개 속성 이름
     */
    public List<String> list() {
        return list(false);
    }

    /**
     * 공개 속성 이름 목록.
     *
     * @param verbose true이면 속성 표를 로깅 협력자로 출력
     * @return 정렬된 공개 속성 이름
     */
    public List<String> list(boolean verbose) {
        List<String> names = entries.keySet().stream()
            .filter(AttributeDescriptor::isPublicName)
            .sorted()
            .collect(Collectors.toUnmodifiableList());

        log.debug("am [{}] have [{}]", ownerClass, String.join(", ", names));

        if (verbose) {
            List<Map<String, Object>> rows = names.stream()
                .map(entries::get)
                .map(entry -> toRow(entry.snapshot()))
                .collect(Collectors.toList());
            tabulator.tabulate(rows, AttributeProperty.NAME.getFieldName());
        }
        return names;
    }

    /**
     * 복제 가능한 속성 이름 목록.
     *
     * <p>공개 속성 중 OPAQUE_HANDLE을 제외한 이름입니다.</p>
     *
     * @return 정렬된 이름 목록
     */
    public List<String> copyableNames() {
        return entries.values().stream()
            .filter(entry -> AttributeDescriptor.isPublicName(entry.name) && entry.kind.isCopyable())
            .map(entry -> entry.name)
            .sorted()
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * 현재 복제 가능한 속성을 상속 대상으로 고정.
     *
     * <p>보통 소유 객체의 생성 마지막에 한 번 호출합니다.
     * 이후에 정의된 속성은 상속 대상이 아닙니다.</p>
     *
     * @return 고정된 상속 대상 이름 목록
     */
    public List<String> captureInheritable() {
        inheritable = copyableNames();
        log.trace("captured {} inheritable attributes", inheritable.size());
        return inheritable;
    }

    /**
     * 상속 대상 이름 목록.
     *
     * @return 생성 시점에 고정된 이름 목록 (변경 불가)
     */
    public List<String> inheritable() {
        return inheritable;
    }

    /**
     * 속성을 정의한 타입 이름.
     *
     * @return 소유 타입 이름
     */
    public String getOwnerClass() {
        return ownerClass;
    }

    /**
     * 정의된 속성 수 (비공개 포함).
     *
     * @return 속성 수
     */
    public int size() {
        return entries.size();
    }

    private Entry require(String name) {
        requireName(name, "attribute");
        Entry entry = entries.get(name);
        if (entry == null) {
            throw new UnknownAttributeException(name);
        }
        return entry;
    }

    private static void requireName(String name, String verb) {
        if (name == null) {
            throw new SyntaxException(verb + " operation must specify an attribute name");
        }
    }

    private List<Entry> resolve(String verb, String name, String... more) {
        requireName(name, verb);
        if (ALL.equals(name)) {
            return new ArrayList<>(entries.values());
        }

        List<String> names = new ArrayList<>();
        names.add(name);
        if (more != null) {
            names.addAll(Arrays.asList(more));
        }

        List<Entry> targets = new ArrayList<>(names.size());
        for (String each : names) {
            targets.add(require(each));
        }
        return targets;
    }

    private Object checkBoolean(String name, AttributeKind kind, Object value) {
        if (kind != AttributeKind.BOOLEAN) {
            return value;
        }
        if (value == null) {
            log.warn("attribute [{}] boolean undefined, defaulting", name);
            return 0;
        }
        if (value instanceof Boolean flag) {
            return flag ? 1 : 0;
        }
        String text = String.valueOf(value);
        if (value instanceof Number number && number.doubleValue() == number.intValue()) {
            text = String.valueOf(number.intValue());
        }
        if ("0".equals(text) || "1".equals(text)) {
            return Integer.valueOf(text);
        }
        throw new InvalidKindException("attribute [" + name + "] value is not boolean [" + value + "], try: { 0, 1 }");
    }

    private static Map<String, Object> toRow(AttributeDescriptor descriptor) {
        Map<String, Object> row = new TreeMap<>();
        for (AttributeProperty property : AttributeProperty.values()) {
            row.put(property.getFieldName(), property.extract(descriptor));
        }
        return row;
    }

    /**
     * 가변 내부 상태. 외부에는 {@link AttributeDescriptor} 스냅샷만 노출합니다.
     */
    private final class Entry {
        private final String name;
        private final AttributeKind kind;
        private Object value;
        private Object defaultValue;
        private boolean readOnly;

        private Entry(String name, AttributeKind kind, Object value, Object defaultValue) {
            this.name = name;
            this.kind = kind;
            this.value = value;
            this.defaultValue = defaultValue;
        }

        private AttributeDescriptor snapshot() {
            return new AttributeDescriptor(name, kind, value, defaultValue, readOnly, ownerClass);
        }
    }
}
