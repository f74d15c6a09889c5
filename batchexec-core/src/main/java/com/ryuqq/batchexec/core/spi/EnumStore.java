package com.ryuqq.batchexec.core.spi;

import com.ryuqq.batchexec.core.lov.EnumClass;

import java.util.Map;
import java.util.Optional;

/**
 * Shared storage SPI for enumeration (LoV) classes.
 *
 * <p>One store is shared by every host object of the library, so implementations
 * hold process-wide mutable state keyed by class name.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: {@code register} and {@code clear} (writers) must be serialized
 *       against {@code find} (readers), e.g. with a read-write lock</li>
 *   <li>Snapshots: {@code find} returns an immutable {@link EnumClass}; later writes
 *       never change a snapshot already handed out</li>
 *   <li>Merge rule: re-registering a class merges entries via {@link EnumClass#merge(Map)}
 *       (existing descriptions win on overlapping keys)</li>
 * </ul>
 *
 * <p><strong>Lifetime:</strong> created once at startup and torn down only by test fixtures.</p>
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public interface EnumStore {

    /**
     * Registers a class, or merges entries into an existing class.
     *
     * @param enumClass the class name
     * @param entries key to description mapping (may be empty)
     * @return the number of entries in the class after registration
     * @throws IllegalArgumentException if enumClass or entries is null
     */
    int register(String enumClass, Map<String, String> entries);

    /**
     * Deletes a class entirely.
     *
     * <p>After clearing, the class is indistinguishable from one never registered.</p>
     *
     * @param enumClass the class name
     * @return the number of entries immediately before deletion, 0 if never registered
     * @throws IllegalArgumentException if enumClass is null
     */
    int clear(String enumClass);

    /**
     * Looks up a snapshot of a class.
     *
     * @param enumClass the class name
     * @return the class snapshot, or empty if not registered
     * @throws IllegalArgumentException if enumClass is null
     */
    Optional<EnumClass> find(String enumClass);
}
