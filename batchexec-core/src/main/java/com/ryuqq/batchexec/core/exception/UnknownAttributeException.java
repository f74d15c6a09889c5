package com.ryuqq.batchexec.core.exception;

/**
 * 정의되지 않은 속성을 참조한 경우.
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public class UnknownAttributeException extends RegistryException {

    private final String attributeName;

    public UnknownAttributeException(String attributeName) {
        super(RegistryErrorCode.UNKNOWN_ATTRIBUTE, "attribute [" + attributeName + "] does not exist");
        this.attributeName = attributeName;
    }

    public String getAttributeName() {
        return attributeName;
    }
}
