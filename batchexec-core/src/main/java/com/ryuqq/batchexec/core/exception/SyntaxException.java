package com.ryuqq.batchexec.core.exception;

/**
 * 필수 인자가 누락되었거나 호출 형식이 잘못된 경우.
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public class SyntaxException extends RegistryException {

    public SyntaxException(String message) {
        super(RegistryErrorCode.SYNTAX, message);
    }
}
