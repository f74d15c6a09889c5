package com.ryuqq.batchexec.core.lov;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 이름이 붙은 유효 값 집합 (LoV 클래스).
 *
 * <p>키는 클래스 내에서 유일하며 사람이 읽을 수 있는 설명을 가집니다.
 * 불변 값 객체이므로 저장소 바깥으로 안전하게 노출할 수 있습니다.</p>
 *
 * <p><strong>병합 규칙:</strong> {@link #merge(Map)}는 키의 합집합을 만들며,
 * 겹치는 키는 기존 설명을 유지합니다 (먼저 등록한 쪽 우선).
 * 설명을 바꾸려면 clear 후 다시 register 합니다.</p>
 *
 * @param name 클래스 이름
 * @param entries 키 → 설명 (키 순 정렬)
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public record EnumClass(String name, SortedMap<String, String> entries) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name 또는 entries가 null인 경우
     */
    public EnumClass {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        // 원본의 comparator와 무관하게 키의 자연 순서로 정렬
        TreeMap<String, String> natural = new TreeMap<>();
        natural.putAll(entries);
        entries = Collections.unmodifiableSortedMap(natural);
    }

    /**
     * 매핑으로부터 생성.
     *
     * @param name 클래스 이름
     * @param entries 키 → 설명
     * @return EnumClass 인스턴스
     */
    public static EnumClass of(String name, Map<String, String> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        TreeMap<String, String> sorted = new TreeMap<>();
        entries.forEach((key, description) -> {
            if (key == null) {
                throw new IllegalArgumentException("entries cannot contain a null key");
            }
            sorted.put(key, description);
        });
        return new EnumClass(name, sorted);
    }

    /**
     * 기존 항목을 유지한 채 새 항목을 병합한 인스턴스 생성.
     *
     * @param additions 추가할 키 → 설명
     * @return 병합된 새 인스턴스
     */
    public EnumClass merge(Map<String, String> additions) {
        TreeMap<String, String> merged = new TreeMap<>(entries);
        EnumClass incoming = of(name, additions);
        incoming.entries().forEach(merged::putIfAbsent);
        return new EnumClass(name, merged);
    }

    /**
     * 정렬된 키 목록.
     *
     * @return 키 목록 (변경 불가)
     */
    public List<String> keys() {
        return List.copyOf(entries.keySet());
    }

    public boolean contains(String key) {
        return key != null && entries.containsKey(key);
    }

    public String description(String key) {
        return key == null ? null : entries.get(key);
    }

    public int size() {
        return entries.size();
    }
}
