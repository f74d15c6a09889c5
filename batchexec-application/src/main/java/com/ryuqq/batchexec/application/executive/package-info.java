/**
 * Batch executive host object and its immutable configuration.
 *
 * <p>{@link com.ryuqq.batchexec.application.executive.BatchExecutive} wires the core
 * registries to the in-memory LoV store and exposes the standard host attributes.</p>
 *
 * @since 1.0.0
 * @author BatchExec Team
 */
package com.ryuqq.batchexec.application.executive;
