package com.ryuqq.batchexec.core.exception;

/**
 * 레지스트리 실패 분류 코드.
 *
 * <p>AttributeRegistry와 EnumRegistry가 발생시키는 모든 실패는
 * 아래 코드 중 하나로 분류됩니다.</p>
 *
 * <ul>
 *   <li>SYNTAX: 필수 인자 누락 또는 잘못된 호출 형식</li>
 *   <li>DUPLICATE_ATTRIBUTE: 이미 정의된 속성 재정의</li>
 *   <li>UNKNOWN_ATTRIBUTE: 정의되지 않은 속성 참조</li>
 *   <li>READ_ONLY_VIOLATION: 읽기 전용 속성에 직접 set</li>
 *   <li>INVALID_KIND: 지원하지 않는 kind 또는 Boolean 제약 위반</li>
 *   <li>UNKNOWN_CLASS: 등록되지 않았거나 삭제된 LoV 클래스</li>
 *   <li>UNKNOWN_KEY: LoV 클래스에 없는 값</li>
 * </ul>
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public enum RegistryErrorCode {

    SYNTAX,
    DUPLICATE_ATTRIBUTE,
    UNKNOWN_ATTRIBUTE,
    READ_ONLY_VIOLATION,
    INVALID_KIND,
    UNKNOWN_CLASS,
    UNKNOWN_KEY
}
