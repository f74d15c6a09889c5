/**
 * Per-object typed attribute registry.
 *
 * <p>This package gives every host object typed, validated and introspectable state:</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.batchexec.core.attribute.AttributeRegistry} - name to descriptor store with
 *       independent current and default values and read-only toggling</li>
 *   <li>{@link com.ryuqq.batchexec.core.attribute.AttributeDescriptor} - immutable snapshot of one attribute</li>
 *   <li>{@link com.ryuqq.batchexec.core.attribute.AttributeKind} - type tag (ANY, BOOLEAN, OPAQUE_HANDLE)</li>
 *   <li>{@link com.ryuqq.batchexec.core.attribute.AttributeProperty} - metadata fields readable via prop</li>
 *   <li>{@link com.ryuqq.batchexec.core.attribute.Attributed} - owner of a registry</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>No reflection:</strong> attributes live in an explicit map accessed by one generic get/set path</li>
 *   <li><strong>Atomic calls:</strong> preconditions are checked before any mutation</li>
 *   <li><strong>Explicit unset:</strong> {@code null} is the only "no value" marker</li>
 * </ul>
 *
 * @since 1.0.0
 * @author BatchExec Team
 */
package com.ryuqq.batchexec.core.attribute;
