/**
 * Failure escalation driven by a single "fatal" switch.
 *
 * @since 1.0.0
 * @author BatchExec Team
 */
package com.ryuqq.batchexec.core.escalation;
