/**
 * Shared controlled-vocabulary (LoV) registry.
 *
 * <ul>
 *   <li>{@link com.ryuqq.batchexec.core.lov.EnumRegistry} - register, merge, validate and assign LoV values</li>
 *   <li>{@link com.ryuqq.batchexec.core.lov.EnumClass} - immutable class snapshot with the merge rule</li>
 *   <li>{@link com.ryuqq.batchexec.core.lov.Chooser} - "choose one of N" abstraction</li>
 *   <li>{@link com.ryuqq.batchexec.core.lov.ShuffleChooser} - shuffle-then-take-first over a process-seeded source</li>
 * </ul>
 *
 * @since 1.0.0
 * @author BatchExec Team
 */
package com.ryuqq.batchexec.core.lov;
