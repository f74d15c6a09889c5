package com.ryuqq.batchexec.core.attribute;

import com.ryuqq.batchexec.core.exception.SyntaxException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * {@link AttributeRegistry#prop(String, AttributeProperty)}로 조회 가능한 메타데이터 필드.
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public enum AttributeProperty {

    OWNER_CLASS("ownerClass", "class"),
    DEFAULT("default", "default"),
    NAME("name", "name"),
    READ_ONLY("readOnly", "ro"),
    KIND("kind", "type"),
    VALUE("value", "value");

    private final String fieldName;
    private final String alias;

    AttributeProperty(String fieldName, String alias) {
        this.fieldName = fieldName;
        this.alias = alias;
    }

    /**
     * 필드 이름 또는 별칭으로 조회.
     *
     * @param field 필드 이름 (예: readOnly) 또는 별칭 (예: ro)
     * @return 해당 필드
     * @throws SyntaxException field가 null이거나 알 수 없는 이름인 경우
     */
    public static AttributeProperty fromName(String field) {
        if (field != null) {
            for (AttributeProperty property : values()) {
                if (property.fieldName.equals(field) || property.alias.equals(field)) {
                    return property;
                }
            }
        }
        throw new SyntaxException(String.format("invalid property [%s], specify one of { %s }",
            field, Arrays.stream(values()).map(AttributeProperty::getFieldName).sorted().collect(Collectors.joining(", "))));
    }

    public String getFieldName() {
        return fieldName;
    }

    /**
     * 스냅샷에서 이 필드의 값을 꺼냄.
     *
     * @param descriptor 속성 스냅샷
     * @return 필드 값 (null 가능)
     */
    Object extract(AttributeDescriptor descriptor) {
        return switch (this) {
            case OWNER_CLASS -> descriptor.ownerClass();
            case DEFAULT -> descriptor.defaultValue();
            case NAME -> descriptor.name();
            case READ_ONLY -> descriptor.readOnly();
            case KIND -> descriptor.kind();
            case VALUE -> descriptor.value();
        };
    }
}
