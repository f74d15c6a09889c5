package com.ryuqq.batchexec.application.executive;

import com.ryuqq.batchexec.adapter.inmemory.store.InMemoryEnumStore;
import com.ryuqq.batchexec.core.attribute.AttributeKind;
import com.ryuqq.batchexec.core.attribute.AttributeRegistry;
import com.ryuqq.batchexec.core.attribute.Attributed;
import com.ryuqq.batchexec.core.clone.CloneEngine;
import com.ryuqq.batchexec.core.clone.ClonePolicy;
import com.ryuqq.batchexec.core.escalation.EscalationPolicy;
import com.ryuqq.batchexec.core.exception.FatalBatchException;
import com.ryuqq.batchexec.core.exception.SyntaxException;
import com.ryuqq.batchexec.core.lov.EnumRegistry;
import com.ryuqq.batchexec.core.lov.ShuffleChooser;
import com.ryuqq.batchexec.core.support.Tabulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 배치 실행 호스트 객체.
 *
 * <p>모든 설정 상태를 {@link AttributeRegistry}에 보관하고, 공유 LoV 레지스트리와
 * 복제 엔진, fatal 스위치 기반 실패 격상 정책을 제공합니다.</p>
 *
 * <p><strong>생성 순서:</strong></p>
 * <pre>
 * 1. 표준 속성 정의 (log, autoheader, dn_start, echo, fatal, leader, maxlen,
 *    prefix, re_whitespace, stdfd, this)
 * 2. sync(ALL): 모든 기본값 = 현재 값
 * 3. ro(log)
 * 4. ExecutiveConfig 적용 (현재 값과 기본값 모두)
 * 5. 인스턴스 ID 부여
 * 6. 상속 대상 속성 고정
 * </pre>
 *
 * <p><strong>공유 LoV:</strong> LoV 레지스트리를 지정하지 않은 인스턴스는 프로세스 전역
 * 레지스트리({@link #sharedLov()})를 공유합니다. 전역 레지스트리는 클래스 로딩 시 한 번 생성되며
 * 테스트 픽스처만 정리합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * BatchExecutive exec = new BatchExecutive(new ExecutiveConfig().withFatal(false));
 *
 * exec.attributes().define("retries", AttributeKind.ANY, 3, 3);
 * exec.lov().register("color", Map.of("red", "desc r", "blue", "desc b"));
 * String description = exec.attempt(() -> exec.lov().lookup("color", "pink"), "(none)");
 * }</pre>
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public class BatchExecutive implements Attributed {

    public static final String LOG = "log";
    public static final String AUTOHEADER = "autoheader";
    public static final String DN_START = "dn_start";
    public static final String ECHO = "echo";
    public static final String FATAL = "fatal";
    public static final String LEADER = "leader";
    public static final String MAXLEN = "maxlen";
    public static final String PREFIX = "prefix";
    public static final String RE_WHITESPACE = "re_whitespace";
    public static final String STDFD = "stdfd";
    public static final String THIS = "this";

    private static final Logger log = LoggerFactory.getLogger(BatchExecutive.class);
    private static final AtomicInteger OBJECTS = new AtomicInteger();
    private static final EnumRegistry SHARED_LOV = new EnumRegistry(new InMemoryEnumStore(), ShuffleChooser.shared());

    private static final String RE_WHITESPACE_DEFAULT = "\\s+";
    private static final int STDFD_MAX = 2;
    private static final DateTimeFormatter HEADER_TIMESTAMP =
        DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss yyyy", Locale.ENGLISH);

    private final AttributeRegistry attributes;
    private final EnumRegistry lov;
    private final CloneEngine cloneEngine;
    private final EscalationPolicy escalation;
    private final int id;

    /**
     * 기본 설정과 공유 LoV 레지스트리로 생성.
     */
    public BatchExecutive() {
        this(new ExecutiveConfig());
    }

    /**
     * 공유 LoV 레지스트리로 생성.
     *
     * @param config 설정
     */
    public BatchExecutive(ExecutiveConfig config) {
        this(config, SHARED_LOV);
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @param lov LoV 레지스트리 (여러 인스턴스가 공유 가능)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BatchExecutive(ExecutiveConfig config, EnumRegistry lov) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (lov == null) {
            throw new IllegalArgumentException("lov cannot be null");
        }
        this.lov = lov;
        this.cloneEngine = new CloneEngine();
        this.attributes = new AttributeRegistry(BatchExecutive.class.getSimpleName(), log);

        String program = config.programName();
        attributes.define(LOG, AttributeKind.OPAQUE_HANDLE, null);
        attributes.define(AUTOHEADER, AttributeKind.BOOLEAN, 0, 0);
        attributes.define(DN_START, AttributeKind.ANY, System.getProperty("user.dir"));
        attributes.define(ECHO, AttributeKind.BOOLEAN, 0, 0);
        attributes.define(FATAL, AttributeKind.BOOLEAN, 1, 1);
        attributes.define(LEADER, AttributeKind.ANY, "#");
        attributes.define(MAXLEN, AttributeKind.ANY, 30);
        attributes.define(PREFIX, AttributeKind.ANY, stripExtension(program));
        attributes.define(RE_WHITESPACE, AttributeKind.ANY, RE_WHITESPACE_DEFAULT);
        attributes.define(STDFD, AttributeKind.ANY, STDFD_MAX);
        attributes.define(THIS, AttributeKind.ANY, program);

        attributes.sync(AttributeRegistry.ALL);
        attributes.ro(LOG);

        attributes.set(FATAL, config.fatal(), config.fatal());
        attributes.set(ECHO, config.echo(), config.echo());
        attributes.set(AUTOHEADER, config.autoheader(), config.autoheader());
        attributes.set(LEADER, config.leader(), config.leader());
        attributes.set(MAXLEN, config.maxlen(), config.maxlen());

        this.escalation = new EscalationPolicy(() -> attributes.isTrue(FATAL), log);
        this.id = OBJECTS.incrementAndGet();

        attributes.captureInheritable();
        log.debug("id [{}]", id);
    }

    /**
     * 프로세스 전역 LoV 레지스트리.
     *
     * @return 공유 EnumRegistry
     */
    public static EnumRegistry sharedLov() {
        return SHARED_LOV;
    }

    @Override
    public AttributeRegistry attributes() {
        return attributes;
    }

    /**
     * 이 인스턴스가 사용하는 LoV 레지스트리.
     *
     * @return EnumRegistry
     */
    public EnumRegistry lov() {
        return lov;
    }

    /**
     * 이 인스턴스의 실패 격상 정책.
     *
     * @return EscalationPolicy
     */
    public EscalationPolicy escalation() {
        return escalation;
    }

    /**
     * 프로세스 내 인스턴스 ID (1부터 증가).
     *
     * @return 인스턴스 ID
     */
    public int id() {
        return id;
    }

    /**
     * 속성 보유 여부.
     *
     * @param name 속성 이름
     * @return 보유하면 true
     */
    public boolean has(String name) {
        return attributes.has(name);
    }

    /**
     * 공개 속성 목록.
     *
     * <p>echo가 켜져 있으면 목록을 INFO로 출력합니다.</p>
     *
     * @param verbose true이면 속성 표 출력
     * @return 정렬된 공개 속성 이름
     */
    public List<String> listAttributes(boolean verbose) {
        List<String> names = attributes.list(verbose);
        if (isEcho()) {
            log.info("am [{}] have [{}]", attributes.getOwnerClass(), String.join(", ", names));
        }
        return names;
    }

    /**
     * 실패 보고. fatal 속성에 따라 중단하거나 경고 후 -1을 반환합니다.
     *
     * @param message 실패 설명
     * @return non-fatal 모드에서 {@link EscalationPolicy#SENTINEL}
     * @throws FatalBatchException fatal 모드인 경우
     */
    public int cough(String message) {
        return escalation.cough(message);
    }

    /**
     * 레지스트리 연산을 fatal 정책 아래에서 실행.
     *
     * @param action 실행할 연산
     * @param sentinel non-fatal 모드 실패 시 반환할 값
     * @param <T> 결과 타입
     * @return 연산 결과 또는 sentinel
     * @throws FatalBatchException fatal 모드에서 연산이 실패한 경우
     */
    public <T> T attempt(Supplier<T> action, T sentinel) {
        return escalation.attempt(action, sentinel);
    }

    /**
     * 생성 시 고정된 상속 대상 속성을 원본에서 복사.
     *
     * @param source 원본 객체
     * @return 복사한 속성 수
     */
    public int inherit(Attributed source) {
        return cloneEngine.inherit(this, source);
    }

    /**
     * 현재 복제 가능한 속성 전체를 정책에 따라 원본에서 복사.
     *
     * @param source 원본 객체
     * @param policy 읽기 전용 처리 규칙
     * @return 실제로 복사한 속성 수
     */
    public int cloneFrom(Attributed source, ClonePolicy policy) {
        return cloneEngine.clone(this, source, policy);
    }

    public boolean isFatal() {
        return attributes.isTrue(FATAL);
    }

    public void setFatal(boolean fatal) {
        attributes.set(FATAL, fatal);
    }

    public boolean isEcho() {
        return attributes.isTrue(ECHO);
    }

    public void setEcho(boolean echo) {
        attributes.set(ECHO, echo);
    }

    public boolean isAutoheader() {
        return attributes.isTrue(AUTOHEADER);
    }

    public String getLeader() {
        return String.valueOf(attributes.get(LEADER));
    }

    public int getMaxlen() {
        Object value = attributes.get(MAXLEN);
        if (value instanceof Number number) {
            return number.intValue();
        }
        return Integer.parseInt(String.valueOf(value));
    }

    public String getDnStart() {
        return String.valueOf(attributes.get(DN_START));
    }

    public String getPrefix() {
        return String.valueOf(attributes.get(PREFIX));
    }

    public String getProgramName() {
        return String.valueOf(attributes.get(THIS));
    }

    /**
     * autoheader가 켜져 있으면 출력 대상에 자동 생성 헤더 두 줄을 기록.
     *
     * <pre>
     * # ---- automatically generated by nightly.sh ----
     * # ---- timestamp Mon Oct 19 09:30:00 2026 ----
     * </pre>
     *
     * <p>autoheader가 꺼져 있으면 아무것도 쓰지 않으며, echo가 켜져 있을 때만 건너뛴 사실을 INFO로 남깁니다.</p>
     *
     * @param out 헤더를 기록할 대상
     * @return 헤더를 기록했으면 true
     * @throws SyntaxException out이 null인 경우
     * @throws IOException 기록에 실패한 경우
     */
    public boolean header(Appendable out) throws IOException {
        if (out == null) {
            throw new SyntaxException("header(OUTPUT) must specify an output");
        }
        if (!isAutoheader()) {
            if (isEcho()) {
                log.info("skipping automatic header");
            }
            return false;
        }
        String leader = getLeader();
        out.append(String.format("%s ---- automatically generated by %s ----\n", leader, getProgramName()));
        out.append(String.format("%s ---- timestamp %s ---- \n", leader, HEADER_TIMESTAMP.format(LocalDateTime.now())));
        return true;
    }

    /**
     * maxlen 길이로 문자열 자르기.
     *
     * @param text 원본 문자열
     * @return 잘린 문자열 (잘린 경우 "..."로 끝남)
     * @throws SyntaxException text가 null인 경우
     */
    public String trunc(String text) {
        return trunc(text, getMaxlen());
    }

    /**
     * 지정 길이로 문자열 자르기.
     *
     * @param text 원본 문자열
     * @param max 최대 길이
     * @return 잘린 문자열
     * @throws SyntaxException text가 null인 경우
     */
    public String trunc(String text, int max) {
        if (text == null) {
            throw new SyntaxException("trunc(EXPR) must specify a string");
        }
        return Tabulator.truncate(text, max);
    }

    /**
     * 문자열 앞뒤에서 정규식 제거.
     *
     * @param text 원본 문자열
     * @param regex 제거할 정규식
     * @return 정리된 문자열
     * @throws SyntaxException 인자가 null인 경우
     */
    public String trim(String text, String regex) {
        if (text == null || regex == null) {
            throw new SyntaxException("trim(EXPR, REGEXP) must specify a string and a pattern");
        }
        String trimmed = text.replaceFirst("^(?:" + regex + ")", "").replaceFirst("(?:" + regex + ")$", "");
        log.trace("trim [{}] -> [{}]", text, trimmed);
        return trimmed;
    }

    /**
     * 문자열 앞뒤 공백 제거 (re_whitespace 속성 사용).
     *
     * @param text 원본 문자열
     * @return 정리된 문자열
     */
    public String trimWhitespace(String text) {
        return trim(text, String.valueOf(attributes.get(RE_WHITESPACE)));
    }

    /**
     * DOS 줄바꿈의 CR 제거.
     *
     * @param text 원본 문자열
     * @return CR이 제거된 문자열
     * @throws SyntaxException text가 null인 경우
     */
    public String stripCarriageReturns(String text) {
        if (text == null) {
            throw new SyntaxException("crlf(EXPR) must specify a string");
        }
        String stripped = text.replaceAll("\n*\r", "");
        if (stripped.length() != text.length()) {
            log.trace("string truncated [{}]", stripped);
        }
        return stripped;
    }

    private static String stripExtension(String program) {
        int dot = program.indexOf('.');
        return dot > 0 ? program.substring(0, dot) : program;
    }
}
