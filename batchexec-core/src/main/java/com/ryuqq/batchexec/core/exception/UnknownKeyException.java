package com.ryuqq.batchexec.core.exception;

import java.util.List;

/**
 * LoV 클래스에 존재하지 않는 값을 참조한 경우.
 *
 * <p>진단을 위해 문제가 된 값과 해당 클래스의 현재 멤버 목록을 함께 보관합니다.</p>
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public class UnknownKeyException extends RegistryException {

    private final String enumClass;
    private final String key;
    private final List<String> members;

    public UnknownKeyException(String enumClass, String key, List<String> members) {
        super(RegistryErrorCode.UNKNOWN_KEY,
            String.format("LoV [%s] contains no such value [%s] %s", enumClass, key, members));
        this.enumClass = enumClass;
        this.key = key;
        this.members = List.copyOf(members);
    }

    public String getEnumClass() {
        return enumClass;
    }

    public String getKey() {
        return key;
    }

    public List<String> getMembers() {
        return members;
    }
}
