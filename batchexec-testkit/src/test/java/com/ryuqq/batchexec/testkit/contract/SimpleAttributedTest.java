package com.ryuqq.batchexec.testkit.contract;

import com.ryuqq.batchexec.core.attribute.AttributeKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SimpleAttributedTest {

    @Test
    void with_DefinesValueAndDefault() {
        // When
        SimpleAttributed target = new SimpleAttributed("Target")
            .with("state", AttributeKind.ANY, "x")
            .with("echo", AttributeKind.BOOLEAN, true);

        // Then
        assertThat(target.attributes().get("state")).isEqualTo("x");
        assertThat(target.attributes().defaultValue("state")).isEqualTo("x");
        assertThat(target.attributes().get("echo")).isEqualTo(1);
        assertThat(target.attributes().getOwnerClass()).isEqualTo("Target");
    }
}
