/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the single-purpose collaborators the orchestrators depend on.
 * Each interface has exactly one axis of change.</p>
 *
 * <h2>User collaborators</h2>
 * <ul>
 *   <li>{@link com.ryuqq.srp.core.spi.UserRepository} - Persistence (id → record upsert)</li>
 *   <li>{@link com.ryuqq.srp.core.spi.UserValidator} - Business rules</li>
 *   <li>{@link com.ryuqq.srp.core.spi.UserPresenter} - Console and JSON formatting</li>
 * </ul>
 *
 * <h2>Invoice collaborators</h2>
 * <ul>
 *   <li>{@link com.ryuqq.srp.core.spi.InvoiceCalculator} - Surcharge calculation</li>
 *   <li>{@link com.ryuqq.srp.core.spi.InvoiceRenderer} - HTML / PDF / CSV rendering</li>
 *   <li>{@link com.ryuqq.srp.core.spi.InvoiceSender} - Delivery notification</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Default implementations live in srp-application; the in-memory repository lives in
 * srp-adapter-inmemory. Tests substitute fakes or Mockito mocks.</p>
 *
 * @since 1.0.0
 * @author SRP Team
 */
package com.ryuqq.srp.core.spi;
