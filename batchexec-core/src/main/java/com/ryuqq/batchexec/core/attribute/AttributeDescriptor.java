package com.ryuqq.batchexec.core.attribute;

/**
 * 속성 하나의 메타데이터 스냅샷.
 *
 * <p>레지스트리 내부 상태의 복사본이므로 수정해도 레지스트리에 반영되지 않습니다.
 * {@link AttributeRegistry#remove(String)}와 {@link AttributeRegistry#describe(String)}가 반환합니다.</p>
 *
 * @param name 속성 이름 (소유 객체 내에서 유일)
 * @param kind 값의 종류
 * @param value 현재 값 (null이면 미설정)
 * @param defaultValue 기본값 (null 가능)
 * @param readOnly 읽기 전용 여부 (직접 set만 차단)
 * @param ownerClass 속성을 정의한 타입 이름 (진단용)
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public record AttributeDescriptor(
    String name,
    AttributeKind kind,
    Object value,
    Object defaultValue,
    boolean readOnly,
    String ownerClass
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name 또는 kind가 null인 경우
     */
    public AttributeDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
    }

    /**
     * 공개 속성 여부.
     *
     * <p>밑줄(_)로 시작하는 이름은 비공개로 취급되어 목록, 상속, 복제에서 제외됩니다.</p>
     *
     * @return 공개 속성이면 true
     */
    public boolean isPublic() {
        return isPublicName(name);
    }

    static boolean isPublicName(String name) {
        return !name.startsWith("_");
    }
}
