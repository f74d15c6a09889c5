/**
 * Rendering helpers for diagnostics.
 *
 * @since 1.0.0
 * @author BatchExec Team
 */
package com.ryuqq.batchexec.core.support;
