/**
 * Test support shared by adapter and application modules.
 *
 * <ul>
 *   <li>{@link com.ryuqq.batchexec.testkit.contract.AbstractEnumStoreContractTest} - EnumStore SPI contract</li>
 *   <li>{@link com.ryuqq.batchexec.testkit.contract.FixedChooser} - deterministic Chooser</li>
 *   <li>{@link com.ryuqq.batchexec.testkit.contract.SimpleAttributed} - minimal Attributed fixture</li>
 * </ul>
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
package com.ryuqq.batchexec.testkit.contract;
