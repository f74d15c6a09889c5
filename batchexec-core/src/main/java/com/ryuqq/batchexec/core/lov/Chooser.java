package com.ryuqq.batchexec.core.lov;

import java.util.List;

/**
 * "N개 중 하나 고르기" 추상화.
 *
 * <p>EnumRegistry는 전역 난수 상태에 직접 의존하지 않고 이 인터페이스를 주입받습니다.
 * 테스트는 결정적인 구현으로 교체할 수 있습니다.</p>
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Chooser {

    /**
     * 후보 중 하나를 선택.
     *
     * @param candidates 후보 목록 (비어 있지 않음)
     * @param <T> 후보 타입
     * @return 선택된 후보 (candidates의 원소)
     */
    <T> T chooseOne(List<T> candidates);
}
