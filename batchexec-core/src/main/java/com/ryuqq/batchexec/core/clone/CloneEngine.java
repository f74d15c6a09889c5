package com.ryuqq.batchexec.core.clone;

import com.ryuqq.batchexec.core.attribute.AttributeRegistry;
import com.ryuqq.batchexec.core.attribute.Attributed;
import com.ryuqq.batchexec.core.exception.InvalidKindException;
import com.ryuqq.batchexec.core.exception.ReadOnlyViolationException;
import com.ryuqq.batchexec.core.exception.SyntaxException;
import com.ryuqq.batchexec.core.exception.UnknownAttributeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 두 {@link Attributed} 객체 사이의 속성 일괄 복사.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. 복사할 이름 결정
 *    - inherit: 대상의 상속 대상 목록 (생성 시 고정)
 *    - clone:   대상의 현재 복제 가능 속성 전체
 * 2. 원본에서 모든 값을 먼저 읽고 대상 kind로 정규화
 *    (UnknownAttributeException, InvalidKindException 시 변경 없음)
 * 3. 읽기 전용 검사 (NORMAL이면 하나라도 있을 때 변경 없이 중단)
 * 4. 정책에 따라 대상에 기록
 * </pre>
 *
 * <p>OPAQUE_HANDLE 속성(로거)은 복사하지 않습니다.</p>
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public final class CloneEngine {

    private static final Logger log = LoggerFactory.getLogger(CloneEngine.class);

    /**
     * 상속 대상 속성을 원본에서 복사.
     *
     * @param target 기록할 객체
     * @param source 읽을 객체
     * @return 복사한 속성 수
     * @throws SyntaxException 인자가 누락된 경우
     * @throws UnknownAttributeException 원본에 해당 속성이 없는 경우
     * @throws ReadOnlyViolationException 대상 속성이 읽기 전용인 경우 (아무것도 복사되지 않음)
     * @throws InvalidKindException 원본 값이 대상 kind에 맞지 않는 경우 (아무것도 복사되지 않음)
     */
    public int inherit(Attributed target, Attributed source) {
        requireBoth(target, source);
        int copied = copy(target.attributes(), source.attributes(), target.attributes().inheritable(), ClonePolicy.NORMAL);
        log.info("inherited {} attributes", copied);
        return copied;
    }

    /**
     * 정책에 따라 복제 가능한 모든 속성을 원본에서 복사.
     *
     * @param target 기록할 객체
     * @param source 읽을 객체
     * @param policy 읽기 전용 처리 규칙
     * @return 실제로 복사한 속성 수 (SKIP으로 제외된 속성 제외)
     * @throws SyntaxException 인자가 누락된 경우
     * @throws UnknownAttributeException 원본에 해당 속성이 없는 경우
     * @throws ReadOnlyViolationException NORMAL 정책에서 대상 속성이 읽기 전용인 경우
     * @throws InvalidKindException 원본 값이 대상 kind에 맞지 않는 경우 (아무것도 복사되지 않음)
     */
    public int clone(Attributed target, Attributed source, ClonePolicy policy) {
        requireBoth(target, source);
        if (policy == null) {
            throw new SyntaxException("clone operation must specify a policy");
        }
        int copied = copy(target.attributes(), source.attributes(), target.attributes().copyableNames(), policy);
        log.info("cloned {} attributes", copied);
        return copied;
    }

    private int copy(AttributeRegistry to, AttributeRegistry from, List<String> names, ClonePolicy policy) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (String name : names) {
            Object value = from.get(name);
            // SKIP 대상은 기록하지 않으므로 kind 검증도 생략
            boolean skipped = policy == ClonePolicy.SKIP && to.describe(name).readOnly();
            values.put(name, skipped ? value : to.check(name, value));
        }

        if (policy == ClonePolicy.NORMAL) {
            for (String name : names) {
                if (to.describe(name).readOnly()) {
                    throw new ReadOnlyViolationException("attribute [" + name + "] is read-only");
                }
            }
        }

        int copied = 0;
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            String name = entry.getKey();
            boolean readOnly = to.describe(name).readOnly();

            if (readOnly && policy == ClonePolicy.SKIP) {
                log.info("skipping read-only attribute change on [{}]", name);
                continue;
            }
            if (readOnly) {
                log.info("forcing read-only attribute change on [{}]", name);
                to.rw(name);
                try {
                    to.set(name, entry.getValue());
                } finally {
                    to.ro(name);
                }
            } else {
                to.set(name, entry.getValue());
            }
            copied++;
        }
        return copied;
    }

    private static void requireBoth(Attributed target, Attributed source) {
        if (target == null || source == null) {
            throw new SyntaxException("you must specify an object from which to clone");
        }
    }
}
