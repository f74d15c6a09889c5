package com.ryuqq.batchexec.core.lov;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ShuffleChooser 테스트.
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
class ShuffleChooserTest {

    @Test
    void chooseOne_SameSeed_SameSequence() {
        // Given
        ShuffleChooser first = new ShuffleChooser(new Random(42L));
        ShuffleChooser second = new ShuffleChooser(new Random(42L));
        List<String> keys = List.of("a", "b", "c", "d");

        // When & Then
        for (int i = 0; i < 20; i++) {
            assertThat(first.chooseOne(keys)).isEqualTo(second.chooseOne(keys));
        }
    }

    @Test
    void chooseOne_DoesNotReorderCandidates() {
        // Given
        List<String> keys = new ArrayList<>(List.of("a", "b", "c"));

        // When
        String chosen = ShuffleChooser.shared().chooseOne(keys);

        // Then
        assertThat(keys).containsExactly("a", "b", "c");
        assertThat(keys).contains(chosen);
    }

    @Test
    void chooseOne_ManyTrials_ObservesEveryCandidate() {
        // Given
        ShuffleChooser chooser = ShuffleChooser.shared();
        List<String> keys = List.of("a", "b", "c", "d");
        Set<String> seen = new HashSet<>();

        // When
        for (int i = 0; i < 1000; i++) {
            seen.add(chooser.chooseOne(keys));
        }

        // Then
        assertThat(seen).containsExactlyInAnyOrderElementsOf(keys);
    }

    @Test
    void chooseOne_Empty_ThrowsException() {
        assertThatThrownBy(() -> ShuffleChooser.shared().chooseOne(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(ShuffleChooser.shared()).isSameAs(ShuffleChooser.shared());
    }
}
