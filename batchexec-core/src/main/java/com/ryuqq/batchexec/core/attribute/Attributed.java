package com.ryuqq.batchexec.core.attribute;

/**
 * {@link AttributeRegistry}를 소유한 객체.
 *
 * <p>EnumRegistry와 CloneEngine은 대상 객체의 상태를 이 인터페이스를 통해서만 읽고 씁니다.</p>
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public interface Attributed {

    /**
     * 이 객체의 속성 레지스트리.
     *
     * @return 속성 레지스트리 (null 불가)
     */
    AttributeRegistry attributes();
}
