package com.ryuqq.batchexec.core.exception;

/**
 * fatal 모드에서 실패가 프로세스 종료 수준으로 격상된 경우.
 *
 * <p>{@link com.ryuqq.batchexec.core.escalation.EscalationPolicy}만 이 예외를 던집니다.
 * 호스트 애플리케이션은 이 예외를 잡지 않고 배치 실행을 중단해야 합니다.</p>
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public class FatalBatchException extends RuntimeException {

    public FatalBatchException(String message) {
        super(message);
    }

    public FatalBatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
