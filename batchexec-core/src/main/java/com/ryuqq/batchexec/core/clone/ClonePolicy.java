package com.ryuqq.batchexec.core.clone;

/**
 * 일괄 복제 시 읽기 전용 대상 속성 처리 규칙.
 *
 * <pre>
 * NORMAL : 읽기 전용 속성이 하나라도 있으면 전체 복제 중단 (부분 변경 없음)
 * FORCE  : 쓰기 가능으로 잠시 전환 → 복사 → 읽기 전용 복원
 * SKIP   : 읽기 전용 속성은 건너뛰고 반환 개수에서도 제외
 * </pre>
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public enum ClonePolicy {

    /**
     * 읽기 전용 속성을 만나면 ReadOnlyViolationException.
     */
    NORMAL,

    /**
     * 읽기 전용 속성도 덮어쓰고 플래그를 복원.
     */
    FORCE,

    /**
     * 읽기 전용 속성은 변경하지 않음.
     */
    SKIP
}
