package com.ryuqq.batchexec.core.exception;

/**
 * 이미 존재하는 이름으로 속성을 다시 정의하려는 경우.
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public class DuplicateAttributeException extends RegistryException {

    public DuplicateAttributeException(String message) {
        super(RegistryErrorCode.DUPLICATE_ATTRIBUTE, message);
    }
}
