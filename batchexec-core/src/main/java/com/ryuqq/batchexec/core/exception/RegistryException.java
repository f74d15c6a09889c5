package com.ryuqq.batchexec.core.exception;

/**
 * 레지스트리 실패의 공통 상위 예외.
 *
 * <p>레지스트리는 사전 조건 위반을 발견하는 즉시, 어떤 상태 변경도 하기 전에
 * 이 예외를 던집니다. 프로세스 종료 여부는 레지스트리가 결정하지 않으며
 * 호출자가 {@link com.ryuqq.batchexec.core.escalation.EscalationPolicy}를 통해 판단합니다.</p>
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public abstract class RegistryException extends RuntimeException {

    private final RegistryErrorCode errorCode;

    protected RegistryException(RegistryErrorCode errorCode, String message) {
        super(message);
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        this.errorCode = errorCode;
    }

    /**
     * 실패 분류 코드 조회.
     *
     * @return 실패 분류 코드
     */
    public RegistryErrorCode getErrorCode() {
        return errorCode;
    }
}
