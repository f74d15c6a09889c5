/**
 * Failure taxonomy of the registries.
 *
 * <p>Every registry failure is a {@link com.ryuqq.batchexec.core.exception.RegistryException}
 * carrying a {@link com.ryuqq.batchexec.core.exception.RegistryErrorCode}.
 * {@link com.ryuqq.batchexec.core.exception.FatalBatchException} is thrown only by the escalation policy.</p>
 *
 * @since 1.0.0
 * @author BatchExec Team
 */
package com.ryuqq.batchexec.core.exception;
