/**
 * Test kit for SPI implementations and orchestrator tests.
 *
 * <ul>
 *   <li>{@link com.ryuqq.srp.testkit.contract.AbstractUserRepositoryContractTest}:
 *       contract every {@link com.ryuqq.srp.core.spi.UserRepository} must satisfy</li>
 *   <li>{@link com.ryuqq.srp.testkit.contract.RecordingInvoiceSender}:
 *       fake {@link com.ryuqq.srp.core.spi.InvoiceSender} capturing deliveries</li>
 * </ul>
 *
 * @author SRP Team
 * @since 1.0.0
 */
package com.ryuqq.srp.testkit.contract;
