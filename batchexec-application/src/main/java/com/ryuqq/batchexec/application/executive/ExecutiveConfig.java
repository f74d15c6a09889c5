package com.ryuqq.batchexec.application.executive;

/**
 * BatchExecutive 설정 (불변 record).
 *
 * <p>생성 시 각 항목은 해당 속성의 현재 값과 기본값에 함께 적용됩니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>fatal: 실패 시 배치 중단 여부 (기본 true)</li>
 *   <li>echo: 선택된 연산의 출력 표시 여부 (기본 false)</li>
 *   <li>autoheader: 출력 파일 헤더 자동 삽입 여부 (기본 false)</li>
 *   <li>leader: 헤더 주석 접두어 (기본 "#")</li>
 *   <li>maxlen: 문자열 자르기 기본 길이 (기본 30)</li>
 *   <li>programName: 실행 중인 프로그램 이름 (기본 "batchexec")</li>
 * </ul>
 *
 * @author BatchExec Team
 * @since 1.0.0
 * @param fatal 실패 시 중단 여부
 * @param echo 출력 표시 여부
 * @param autoheader 헤더 자동 삽입 여부
 * @param leader 헤더 주석 접두어 (null 불가)
 * @param maxlen 문자열 자르기 기본 길이 (3보다 커야 함)
 * @param programName 프로그램 이름 (null 또는 빈 문자열 불가)
 */
public record ExecutiveConfig(
    boolean fatal,
    boolean echo,
    boolean autoheader,
    String leader,
    int maxlen,
    String programName
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: fatal=true, echo=false, autoheader=false, leader="#", maxlen=30, programName="batchexec"</p>
     */
    public ExecutiveConfig() {
        this(true, false, false, "#", 30, "batchexec");
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ExecutiveConfig {
        if (leader == null) {
            throw new IllegalArgumentException("leader cannot be null");
        }
        if (maxlen <= 3) {
            throw new IllegalArgumentException(
                "maxlen must be greater than 3 (current: " + maxlen + ")"
            );
        }
        if (programName == null || programName.isBlank()) {
            throw new IllegalArgumentException("programName cannot be null or blank");
        }
    }

    /**
     * fatal만 변경한 새 인스턴스 생성.
     *
     * @param fatal 실패 시 중단 여부
     * @return 새 ExecutiveConfig 인스턴스
     */
    public ExecutiveConfig withFatal(boolean fatal) {
        return new ExecutiveConfig(fatal, echo, autoheader, leader, maxlen, programName);
    }

    /**
     * echo만 변경한 새 인스턴스 생성.
     *
     * @param echo 출력 표시 여부
     * @return 새 ExecutiveConfig 인스턴스
     */
    public ExecutiveConfig withEcho(boolean echo) {
        return new ExecutiveConfig(fatal, echo, autoheader, leader, maxlen, programName);
    }

    /**
     * autoheader만 변경한 새 인스턴스 생성.
     *
     * @param autoheader 헤더 자동 삽입 여부
     * @return 새 ExecutiveConfig 인스턴스
     */
    public ExecutiveConfig withAutoheader(boolean autoheader) {
        return new ExecutiveConfig(fatal, echo, autoheader, leader, maxlen, programName);
    }

    /**
     * leader만 변경한 새 인스턴스 생성.
     *
     * @param leader 헤더 주석 접두어
     * @return 새 ExecutiveConfig 인스턴스
     */
    public ExecutiveConfig withLeader(String leader) {
        return new ExecutiveConfig(fatal, echo, autoheader, leader, maxlen, programName);
    }

    /**
     * maxlen만 변경한 새 인스턴스 생성.
     *
     * @param maxlen 문자열 자르기 기본 길이
     * @return 새 ExecutiveConfig 인스턴스
     */
    public ExecutiveConfig withMaxlen(int maxlen) {
        return new ExecutiveConfig(fatal, echo, autoheader, leader, maxlen, programName);
    }

    /**
     * programName만 변경한 새 인스턴스 생성.
     *
     * @param programName 프로그램 이름
     * @return 새 ExecutiveConfig 인스턴스
     */
    public ExecutiveConfig withProgramName(String programName) {
        return new ExecutiveConfig(fatal, echo, autoheader, leader, maxlen, programName);
    }
}
