package com.ryuqq.batchexec.core.exception;

/**
 * 지원하지 않는 kind이거나 Boolean 속성에 0/1 이외의 값을 지정한 경우.
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public class InvalidKindException extends RegistryException {

    public InvalidKindException(String message) {
        super(RegistryErrorCode.INVALID_KIND, message);
    }
}
