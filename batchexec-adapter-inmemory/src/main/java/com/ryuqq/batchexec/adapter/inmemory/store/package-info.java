/**
 * In-memory EnumStore adapter implementation package.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.batchexec.adapter.inmemory.store.InMemoryEnumStore}:
 *       Read-write-locked in-memory implementation of {@link com.ryuqq.batchexec.core.spi.EnumStore}</li>
 * </ul>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Concurrency:</strong> writers serialized against readers with
 *       {@link java.util.concurrent.locks.ReentrantReadWriteLock}</li>
 *   <li><strong>Snapshots:</strong> readers receive immutable {@link com.ryuqq.batchexec.core.lov.EnumClass} values</li>
 * </ul>
 *
 * @see com.ryuqq.batchexec.core.spi.EnumStore
 * @author BatchExec Team
 * @since 1.0.0
 */
package com.ryuqq.batchexec.adapter.inmemory.store;
