package com.ryuqq.batchexec.core.exception;

/**
 * 읽기 전용 속성에 직접 set을 시도한 경우. 저장된 상태는 변경되지 않습니다.
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public class ReadOnlyViolationException extends RegistryException {

    public ReadOnlyViolationException(String message) {
        super(RegistryErrorCode.READ_ONLY_VIOLATION, message);
    }
}
