package com.ryuqq.batchexec.adapter.inmemory.store;

import com.ryuqq.batchexec.core.lov.EnumClass;
import com.ryuqq.batchexec.core.spi.EnumStore;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory implementation of {@link EnumStore} SPI.
 *
 * <p>Classes are kept as immutable {@link EnumClass} snapshots in a {@link HashMap}
 * guarded by a {@link ReentrantReadWriteLock}: writers ({@code register}, {@code clear})
 * take the write lock, readers ({@code find}) take the read lock and receive a snapshot
 * that later writes never change.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>classes:</strong> HashMap&lt;String, EnumClass&gt; - class name to snapshot (O(1) access)</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Shared only within one JVM</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * EnumStore store = new InMemoryEnumStore();
 *
 * store.register("color", Map.of("red", "desc r", "blue", "desc b"));   // 2
 * store.register("color", Map.of("green", "desc g"));                    // 3 (merged)
 * store.find("color").map(EnumClass::keys);                             // [blue, green, red]
 * store.clear("color");                                                  // 3
 * </pre>
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public class InMemoryEnumStore implements EnumStore {

    private final Map<String, EnumClass> classes;
    private final ReadWriteLock lock;

    /**
     * Creates a new InMemoryEnumStore with empty storage.
     */
    public InMemoryEnumStore() {
        this.classes = new HashMap<>();
        this.lock = new ReentrantReadWriteLock();
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Unseen class: stored verbatim</li>
     *   <li>Existing class: merged, existing descriptions win</li>
     *   <li>Lookup and replacement happen under one write lock</li>
     * </ul>
     */
    @Override
    public int register(String enumClass, Map<String, String> entries) {
        if (enumClass == null) {
            throw new IllegalArgumentException("enumClass cannot be null");
        }
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }

        lock.writeLock().lock();
        try {
            EnumClass existing = classes.get(enumClass);
            EnumClass updated = existing == null
                ? EnumClass.of(enumClass, entries)
                : existing.merge(entries);
            classes.put(enumClass, updated);
            return updated.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int clear(String enumClass) {
        if (enumClass == null) {
            throw new IllegalArgumentException("enumClass cannot be null");
        }

        lock.writeLock().lock();
        try {
            EnumClass removed = classes.remove(enumClass);
            return removed == null ? 0 : removed.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<EnumClass> find(String enumClass) {
        if (enumClass == null) {
            throw new IllegalArgumentException("enumClass cannot be null");
        }

        lock.readLock().lock();
        try {
            return Optional.ofNullable(classes.get(enumClass));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the number of registered classes.
     *
     * <p>This method is used for test assertions.</p>
     *
     * @return the number of classes
     */
    public int size() {
        lock.readLock().lock();
        try {
            return classes.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Clears all registered classes.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clearAll() {
        lock.writeLock().lock();
        try {
            classes.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
