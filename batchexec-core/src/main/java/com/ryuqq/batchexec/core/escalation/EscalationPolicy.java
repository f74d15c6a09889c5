package com.ryuqq.batchexec.core.escalation;

import com.ryuqq.batchexec.core.exception.FatalBatchException;
import com.ryuqq.batchexec.core.exception.RegistryException;
import org.slf4j.Logger;

import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * 실패 격상 정책.
 *
 * <p>레지스트리는 종료 여부를 판단하지 않고 구조화된 예외만 던집니다.
 * 이 정책이 호스트 객체의 "fatal" 스위치를 읽어 둘 중 하나를 선택합니다.</p>
 *
 * <ul>
 *   <li>fatal 모드: ERROR 로그 후 {@link FatalBatchException}으로 격상 (배치 중단)</li>
 *   <li>non-fatal 모드: WARN 로그 후 sentinel 값 반환 (처리 계속)</li>
 * </ul>
 *
 * <p>fatal 스위치는 호출 시점마다 다시 읽으므로 실행 중 전환이 즉시 반영됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * EscalationPolicy policy = new EscalationPolicy(() -> attributes.isTrue("fatal"), log);
 *
 * if (!ready) {
 *     return policy.cough("directory [" + dn + "] not accessible");   // -1 또는 중단
 * }
 * String description = policy.attempt(() -> lov.lookup("color", key), null);
 * }</pre>
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public final class EscalationPolicy {

    /**
     * non-fatal 모드에서 {@link #cough(String)}가 반환하는 값.
     */
    public static final int SENTINEL = -1;

    private final BooleanSupplier fatal;
    private final Logger log;

    /**
     * 생성자.
     *
     * @param fatal fatal 스위치
     * @param log 로깅 협력자
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public EscalationPolicy(BooleanSupplier fatal, Logger log) {
        if (fatal == null) {
            throw new IllegalArgumentException("fatal cannot be null");
        }
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        this.fatal = fatal;
        this.log = log;
    }

    /**
     * 실패 메시지 보고.
     *
     * @param message 실패 설명
     * @return non-fatal 모드에서 {@link #SENTINEL}
     * @throws FatalBatchException fatal 모드인 경우
     */
    public int cough(String message) {
        if (fatal.getAsBoolean()) {
            log.error("FATAL {}", message);
            throw new FatalBatchException(message);
        }
        log.warn("WARNING {}", message);
        return SENTINEL;
    }

    /**
     * 레지스트리 연산 실행 후 실패를 정책에 따라 처리.
     *
     * <p>{@link RegistryException}만 처리하며 그 외 예외는 그대로 전파됩니다.</p>
     *
     * @param action 실행할 연산
     * @param sentinel non-fatal 모드에서 실패 시 반환할 값
     * @param <T> 결과 타입
     * @return 연산 결과, 또는 non-fatal 모드 실패 시 sentinel
     * @throws FatalBatchException fatal 모드에서 연산이 실패한 경우 (원인 예외 포함)
     */
    public <T> T attempt(Supplier<T> action, T sentinel) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        try {
            return action.get();
        } catch (RegistryException e) {
            if (fatal.getAsBoolean()) {
                log.error("FATAL [{}] {}", e.getErrorCode(), e.getMessage());
                throw new FatalBatchException(e.getMessage(), e);
            }
            log.warn("WARNING [{}] {}", e.getErrorCode(), e.getMessage());
            return sentinel;
        }
    }

    /**
     * 현재 fatal 모드 여부.
     *
     * @return fatal 모드이면 true
     */
    public boolean isFatal() {
        return fatal.getAsBoolean();
    }
}
