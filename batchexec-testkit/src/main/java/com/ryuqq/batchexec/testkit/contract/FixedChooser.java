package com.ryuqq.batchexec.testkit.contract;

import com.ryuqq.batchexec.core.lov.Chooser;

import java.util.List;

/**
 * Deterministic {@link Chooser} for tests.
 *
 * <p>Returns candidates by a fixed, cycling sequence of indexes. With no indexes
 * configured it always returns the first candidate.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * FixedChooser chooser = new FixedChooser(1, 0);
 * chooser.chooseOne(List.of("blue", "red"));   // red
 * chooser.chooseOne(List.of("blue", "red"));   // blue
 * chooser.chooseOne(List.of("blue", "red"));   // red
 * </pre>
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public final class FixedChooser implements Chooser {

    private final int[] picks;
    private int invocations;

    /**
     * Creates a chooser that cycles through the given indexes.
     *
     * @param picks candidate indexes, each non-negative
     * @throws IllegalArgumentException if any index is negative
     */
    public FixedChooser(int... picks) {
        for (int pick : picks) {
            if (pick < 0) {
                throw new IllegalArgumentException("pick must be non-negative (current: " + pick + ")");
            }
        }
        this.picks = picks.clone();
    }

    /**
     * Creates a chooser that always returns the first candidate.
     *
     * @return a new FixedChooser
     */
    public static FixedChooser first() {
        return new FixedChooser();
    }

    @Override
    public <T> T chooseOne(List<T> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("candidates cannot be null or empty");
        }
        int index = picks.length == 0 ? 0 : picks[invocations % picks.length];
        invocations++;
        if (index >= candidates.size()) {
            throw new IllegalStateException(
                String.format("pick %d out of range for %d candidates", index, candidates.size())
            );
        }
        return candidates.get(index);
    }

    /**
     * Returns how many times {@link #chooseOne(List)} has been called.
     *
     * @return the invocation count
     */
    public int invocations() {
        return invocations;
    }
}
