package com.ryuqq.batchexec.application.executive;

import com.ryuqq.batchexec.adapter.inmemory.store.InMemoryEnumStore;
import com.ryuqq.batchexec.core.attribute.AttributeKind;
import com.ryuqq.batchexec.core.attribute.AttributeRegistry;
import com.ryuqq.batchexec.core.clone.ClonePolicy;
import com.ryuqq.batchexec.core.escalation.EscalationPolicy;
import com.ryuqq.batchexec.core.exception.FatalBatchException;
import com.ryuqq.batchexec.core.exception.ReadOnlyViolationException;
import com.ryuqq.batchexec.core.exception.SyntaxException;
import com.ryuqq.batchexec.core.exception.UnknownAttributeException;
import com.ryuqq.batchexec.core.lov.EnumRegistry;
import com.ryuqq.batchexec.testkit.contract.FixedChooser;
import com.ryuqq.batchexec.testkit.contract.SimpleAttributed;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BatchExecutive 통합 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>생성 순서 (표준 속성 정의, sync, log 읽기 전용, 설정 적용, 상속 대상 고정)</li>
 *   <li>fatal 스위치에 따른 cough / attempt 동작</li>
 *   <li>inherit / cloneFrom 위임</li>
 *   <li>문자열 보조 연산</li>
 *   <li>공유 LoV 레지스트리</li>
 * </ul>
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
class BatchExecutiveTest {

    private EnumRegistry lov;

    @BeforeEach
    void setUp() {
        lov = new EnumRegistry(new InMemoryEnumStore(), FixedChooser.first());
    }

    @AfterEach
    void tearDown() {
        BatchExecutive.sharedLov().clear("shared-color");
    }

    // ============================================================
    // 1. 생성
    // ============================================================

    @Test
    void constructor_DefaultConfig_DefinesStandardAttributes() {
        // When
        BatchExecutive exec = new BatchExecutive(new ExecutiveConfig(), lov);

        // Then
        assertThat(exec.attributes().list()).containsExactly(
            "autoheader", "dn_start", "echo", "fatal", "leader", "log",
            "maxlen", "prefix", "re_whitespace", "stdfd", "this");
        assertThat(exec.isFatal()).isTrue();
        assertThat(exec.isEcho()).isFalse();
        assertThat(exec.isAutoheader()).isFalse();
        assertThat(exec.getLeader()).isEqualTo("#");
        assertThat(exec.getMaxlen()).isEqualTo(30);
        assertThat(exec.getPrefix()).isEqualTo("batchexec");
        assertThat(exec.getProgramName()).isEqualTo("batchexec");
        assertThat(exec.getDnStart()).isEqualTo(System.getProperty("user.dir"));
        assertThat(exec.attributes().get(BatchExecutive.STDFD)).isEqualTo(2);
    }

    @Test
    void constructor_Config_AppliedAsValueAndDefault() {
        // Given
        ExecutiveConfig config = new ExecutiveConfig()
            .withFatal(false)
            .withEcho(true)
            .withLeader(">")
            .withMaxlen(12)
            .withProgramName("nightly.sh");

        // When
        BatchExecutive exec = new BatchExecutive(config, lov);
        exec.attributes().reset(AttributeRegistry.ALL);

        // Then
        assertThat(exec.isFatal()).isFalse();
        assertThat(exec.isEcho()).isTrue();
        assertThat(exec.getLeader()).isEqualTo(">");
        assertThat(exec.getMaxlen()).isEqualTo(12);
        assertThat(exec.getPrefix()).isEqualTo("nightly");
        assertThat(exec.getProgramName()).isEqualTo("nightly.sh");
        assertThat(exec.attributes().defaultValue(BatchExecutive.FATAL)).isEqualTo(0);
    }

    @Test
    void constructor_LogHandleIsReadOnlyAndNotInheritable() {
        // When
        BatchExecutive exec = new BatchExecutive(new ExecutiveConfig(), lov);

        // Then
        assertThat(exec.attributes().describe(BatchExecutive.LOG).readOnly()).isTrue();
        assertThat(exec.attributes().describe(BatchExecutive.LOG).kind()).isEqualTo(AttributeKind.OPAQUE_HANDLE);
        assertThatThrownBy(() -> exec.attributes().set(BatchExecutive.LOG, "other"))
            .isInstanceOf(ReadOnlyViolationException.class);
        assertThat(exec.attributes().inheritable())
            .hasSize(10)
            .doesNotContain(BatchExecutive.LOG);
    }

    @Test
    void id_AssignedMonotonically() {
        // When
        BatchExecutive first = new BatchExecutive(new ExecutiveConfig(), lov);
        BatchExecutive second = new BatchExecutive(new ExecutiveConfig(), lov);

        // Then
        assertThat(first.id()).isPositive();
        assertThat(second.id()).isGreaterThan(first.id());
    }

    @Test
    void constructor_NullArguments_ThrowsException() {
        assertThatThrownBy(() -> new BatchExecutive(null, lov))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config cannot be null");
        assertThatThrownBy(() -> new BatchExecutive(new ExecutiveConfig(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("lov cannot be null");
    }

    // ============================================================
    // 2. fatal 정책
    // ============================================================

    @Test
    void cough_FatalDefault_Throws() {
        // Given
        BatchExecutive exec = new BatchExecutive(new ExecutiveConfig(), lov);

        // When & Then
        assertThatThrownBy(() -> exec.cough("directory [/tmp/x] not accessible"))
            .isInstanceOf(FatalBatchException.class)
            .hasMessageContaining("/tmp/x");
    }

    @Test
    void cough_AfterSetFatalFalse_ReturnsSentinel() {
        // Given
        BatchExecutive exec = new BatchExecutive(new ExecutiveConfig(), lov);

        // When
        exec.setFatal(false);

        // Then
        assertThat(exec.cough("directory [/tmp/x] not accessible")).isEqualTo(EscalationPolicy.SENTINEL);
        assertThat(exec.escalation().isFatal()).isFalse();
    }

    @Test
    void attempt_SameFailureBothModes_SentinelOrFatal() {
        // Given
        BatchExecutive lenient = new BatchExecutive(new ExecutiveConfig().withFatal(false), lov);
        BatchExecutive strict = new BatchExecutive(new ExecutiveConfig(), lov);
        lov.register("color", Map.of("red", "desc r"));

        // When
        String found = lenient.attempt(() -> lenient.lov().lookup("color", "red"), "(none)");
        String missing = lenient.attempt(() -> lenient.lov().lookup("color", "pink"), "(none)");

        // Then
        assertThat(found).isEqualTo("desc r");
        assertThat(missing).isEqualTo("(none)");
        assertThatThrownBy(() -> strict.attempt(() -> strict.lov().lookup("color", "pink"), "(none)"))
            .isInstanceOf(FatalBatchException.class);
    }

    // ============================================================
    // 3. LoV
    // ============================================================

    @Test
    void lov_ConditionalDefaultAndRandomOnHostAttributes() {
        // Given
        BatchExecutive exec = new BatchExecutive(new ExecutiveConfig(), lov);
        exec.attributes().define("state", AttributeKind.ANY, null);
        exec.lov().register("color", Map.of("red", "desc r", "blue", "desc b"));

        // When
        exec.lov().conditionalDefault("color", exec, "state", "blue");
        exec.lov().random("color", exec, "leader");

        // Then
        assertThat(exec.attributes().get("state")).isEqualTo("blue");
        assertThat(exec.getLeader()).isEqualTo("blue");
    }

    @Test
    void sharedLov_VisibleAcrossDefaultInstances() {
        // Given
        BatchExecutive first = new BatchExecutive();
        BatchExecutive second = new BatchExecutive(new ExecutiveConfig().withEcho(true));

        // When
        first.lov().register("shared-color", Map.of("red", "desc r"));

        // Then
        assertThat(second.lov()).isSameAs(BatchExecutive.sharedLov());
        assertThat(second.lov().isMember("shared-color", "red")).isTrue();
    }

    // ============================================================
    // 4. inherit / cloneFrom
    // ============================================================

    @Test
    void inherit_FromParent_CopiesInheritableAttributes() {
        // Given
        BatchExecutive parent = new BatchExecutive(new ExecutiveConfig().withLeader(">").withEcho(true), lov);
        BatchExecutive child = new BatchExecutive(new ExecutiveConfig(), lov);

        // When
        int copied = child.inherit(parent);

        // Then
        assertThat(copied).isEqualTo(10);
        assertThat(child.getLeader()).isEqualTo(">");
        assertThat(child.isEcho()).isTrue();
    }

    @Test
    void cloneFrom_SkipReadOnly_CountExcludesSkipped() {
        // Given
        BatchExecutive source = new BatchExecutive(new ExecutiveConfig().withLeader(">"), lov);
        BatchExecutive target = new BatchExecutive(new ExecutiveConfig(), lov);
        target.attributes().ro(BatchExecutive.LEADER);

        // When
        int copied = target.cloneFrom(source, ClonePolicy.SKIP);

        // Then
        assertThat(copied).isEqualTo(9);
        assertThat(target.getLeader()).isEqualTo("#");
    }

    @Test
    void cloneFrom_ForceReadOnly_OverwritesAndRestores() {
        // Given
        BatchExecutive source = new BatchExecutive(new ExecutiveConfig().withLeader(">"), lov);
        BatchExecutive target = new BatchExecutive(new ExecutiveConfig(), lov);
        target.attributes().ro(BatchExecutive.LEADER);

        // When
        target.cloneFrom(source, ClonePolicy.FORCE);

        // Then
        assertThat(target.getLeader()).isEqualTo(">");
        assertThat(target.attributes().describe(BatchExecutive.LEADER).readOnly()).isTrue();
    }

    @Test
    void inherit_FromFixtureMissingAttributes_ChangesNothing() {
        // Given
        BatchExecutive child = new BatchExecutive(new ExecutiveConfig(), lov);
        SimpleAttributed partial = new SimpleAttributed("Partial")
            .with(BatchExecutive.AUTOHEADER, AttributeKind.BOOLEAN, 1);

        // When & Then
        assertThatThrownBy(() -> child.inherit(partial))
            .isInstanceOf(UnknownAttributeException.class);
        assertThat(child.isAutoheader()).isFalse();
    }

    // ============================================================
    // 5. 자동 헤더
    // ============================================================

    @Test
    void header_AutoheaderOn_WritesGeneratedAndTimestampLines() throws IOException {
        // Given
        BatchExecutive exec = new BatchExecutive(
            new ExecutiveConfig().withAutoheader(true).withLeader("--").withProgramName("nightly.sh"), lov);
        StringBuilder out = new StringBuilder();

        // When
        boolean written = exec.header(out);

        // Then
        assertThat(written).isTrue();
        String[] lines = out.toString().split("\n");
        assertThat(lines).hasSize(2);
        assertThat(lines[0]).isEqualTo("-- ---- automatically generated by nightly.sh ----");
        assertThat(lines[1]).matches("-- ---- timestamp \\w{3} \\w{3} \\d{1,2} \\d{2}:\\d{2}:\\d{2} \\d{4} ---- ");
    }

    @Test
    void header_AutoheaderOff_WritesNothing() throws IOException {
        // Given
        BatchExecutive exec = new BatchExecutive(new ExecutiveConfig().withEcho(true), lov);
        StringBuilder out = new StringBuilder();

        // When
        boolean written = exec.header(out);

        // Then
        assertThat(written).isFalse();
        assertThat(out).isEmpty();
    }

    @Test
    void header_AutoheaderToggledAtRuntime_FollowsAttribute() throws IOException {
        // Given
        BatchExecutive exec = new BatchExecutive(new ExecutiveConfig(), lov);
        exec.attributes().set(BatchExecutive.AUTOHEADER, 1);
        StringWriter out = new StringWriter();

        // When
        boolean written = exec.header(out);

        // Then
        assertThat(written).isTrue();
        assertThat(out.toString()).startsWith("# ---- automatically generated by batchexec ----\n");
        assertThatThrownBy(() -> exec.header(null)).isInstanceOf(SyntaxException.class);
    }

    // ============================================================
    // 6. 문자열 보조 연산
    // ============================================================

    @Test
    void trunc_UsesMaxlenOrExplicitWidth() {
        // Given
        BatchExecutive exec = new BatchExecutive(new ExecutiveConfig().withMaxlen(10), lov);

        // When & Then
        assertThat(exec.trunc("abcdefghijklmnop")).isEqualTo("abcdefg...");
        assertThat(exec.trunc("short")).isEqualTo("short");
        assertThat(exec.trunc("abcdefghijklmnop", 6)).isEqualTo("abc...");
        assertThatThrownBy(() -> exec.trunc(null)).isInstanceOf(SyntaxException.class);
    }

    @Test
    void trim_RemovesPatternAtBothEnds() {
        // Given
        BatchExecutive exec = new BatchExecutive(new ExecutiveConfig(), lov);

        // When & Then
        assertThat(exec.trimWhitespace("  hello world \t")).isEqualTo("hello world");
        assertThat(exec.trim("#a#b#", "#")).isEqualTo("a#b");
        assertThatThrownBy(() -> exec.trim("text", null)).isInstanceOf(SyntaxException.class);
    }

    @Test
    void stripCarriageReturns_RemovesDosLineEndings() {
        // Given
        BatchExecutive exec = new BatchExecutive(new ExecutiveConfig(), lov);

        // When & Then
        assertThat(exec.stripCarriageReturns("line1\r\nline2\r\n")).isEqualTo("line1\nline2\n");
        assertThat(exec.stripCarriageReturns("unix\n")).isEqualTo("unix\n");
        assertThatThrownBy(() -> exec.stripCarriageReturns(null)).isInstanceOf(SyntaxException.class);
    }

    @Test
    void accessors_NonStringValues_RenderedAsText() {
        // Given
        BatchExecutive exec = new BatchExecutive(new ExecutiveConfig(), lov);
        exec.attributes().set(BatchExecutive.DN_START, Path.of("/var/batch"));
        exec.attributes().set(BatchExecutive.PREFIX, 42);
        exec.attributes().set(BatchExecutive.THIS, null);

        // When & Then
        assertThat(exec.getDnStart()).isEqualTo(Path.of("/var/batch").toString());
        assertThat(exec.getPrefix()).isEqualTo("42");
        assertThat(exec.getProgramName()).isEqualTo("null");
    }

    @Test
    void attempt_NonFatalRegisterWithUndefinedKey_ReturnsSentinel() {
        // Given
        BatchExecutive exec = new BatchExecutive(new ExecutiveConfig().withFatal(false), lov);
        Map<String, String> entries = new HashMap<>();
        entries.put(null, "nothing");

        // When
        Integer count = exec.attempt(() -> exec.lov().register("color", entries), -1);

        // Then
        assertThat(count).isEqualTo(-1);
        assertThat(exec.lov().isMember("color", "nothing")).isFalse();
    }

    @Test
    void listAttributes_Verbose_ReturnsPublicNames() {
        // Given
        BatchExecutive exec = new BatchExecutive(new ExecutiveConfig().withEcho(true), lov);
        exec.attributes().define("_private", AttributeKind.ANY, 1);

        // When & Then
        assertThat(exec.listAttributes(true))
            .hasSize(11)
            .doesNotContain("_private");
        assertThat(exec.has("_private")).isTrue();
    }
}
