/**
 * Service Provider Interfaces implemented by adapters.
 *
 * <ul>
 *   <li>{@link com.ryuqq.batchexec.core.spi.EnumStore} - process-wide storage of LoV classes</li>
 * </ul>
 *
 * @see com.ryuqq.batchexec.core.lov.EnumRegistry
 * @since 1.0.0
 * @author BatchExec Team
 */
package com.ryuqq.batchexec.core.spi;
