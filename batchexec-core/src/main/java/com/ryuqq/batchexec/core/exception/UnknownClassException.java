package com.ryuqq.batchexec.core.exception;

/**
 * 등록된 적이 없거나 clear된 LoV 클래스를 참조한 경우.
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public class UnknownClassException extends RegistryException {

    public UnknownClassException(String message) {
        super(RegistryErrorCode.UNKNOWN_CLASS, message);
    }
}
