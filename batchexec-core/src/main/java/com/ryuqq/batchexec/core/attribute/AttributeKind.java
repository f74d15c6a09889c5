package com.ryuqq.batchexec.core.attribute;

import com.ryuqq.batchexec.core.exception.InvalidKindException;
import com.ryuqq.batchexec.core.exception.SyntaxException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 속성이 가질 수 있는 값의 종류.
 *
 * <ul>
 *   <li>ANY (any): 어떤 값이든 허용</li>
 *   <li>BOOLEAN (bool): 0 또는 1만 허용</li>
 *   <li>OPAQUE_HANDLE (log): 주입된 로거 핸들. 검증, 복제, 상속 대상에서 제외</li>
 * </ul>
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public enum AttributeKind {

    ANY("any", "Attribute can take any value"),

    BOOLEAN("bool", "Attribute takes a boolean value [0, 1]"),

    OPAQUE_HANDLE("log", "A logger handle associated with the owning class");

    private final String tag;
    private final String description;

    AttributeKind(String tag, String description) {
        this.tag = tag;
        this.description = description;
    }

    /**
     * 텍스트 태그로 kind 조회.
     *
     * @param tag kind 태그 (any, bool, log)
     * @return 해당 kind
     * @throws SyntaxException tag가 null인 경우
     * @throws InvalidKindException 알 수 없는 태그인 경우
     */
    public static AttributeKind fromTag(String tag) {
        if (tag == null) {
            throw new SyntaxException("define operation must specify a type");
        }
        for (AttributeKind kind : values()) {
            if (kind.tag.equals(tag)) {
                return kind;
            }
        }
        throw new InvalidKindException(String.format("type [%s] does not exist, try: { %s }",
            tag, Arrays.stream(values()).map(AttributeKind::getTag).sorted().collect(Collectors.joining(", "))));
    }

    public String getTag() {
        return tag;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 복제 및 상속 대상 여부.
     *
     * @return OPAQUE_HANDLE이 아니면 true
     */
    public boolean isCopyable() {
        return this != OPAQUE_HANDLE;
    }
}
