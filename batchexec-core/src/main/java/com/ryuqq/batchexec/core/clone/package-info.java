/**
 * Bulk attribute copy between two attributed objects.
 *
 * @since 1.0.0
 * @author BatchExec Team
 */
package com.ryuqq.batchexec.core.clone;
