package com.ryuqq.batchexec.adapter.inmemory.store;

import com.ryuqq.batchexec.core.spi.EnumStore;
import com.ryuqq.batchexec.testkit.contract.AbstractEnumStoreContractTest;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Tests for InMemoryEnumStore implementation.
 *
 * <p>Runs every scenario of {@link AbstractEnumStoreContractTest} plus checks of the
 * test-support methods.</p>
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
class InMemoryEnumStoreContractTest extends AbstractEnumStoreContractTest {

    @Override
    protected EnumStore createStore() {
        return new InMemoryEnumStore();
    }

    @Test
    void clearAll_RemovesEveryClass() {
        // Given
        InMemoryEnumStore inMemory = (InMemoryEnumStore) store;
        inMemory.register("color", Map.of("red", "r"));
        inMemory.register("size", Map.of("s", "small"));

        // When
        inMemory.clearAll();

        // Then
        assertThat(inMemory.size()).isZero();
        assertThat(inMemory.find("color")).isEmpty();
    }
}
