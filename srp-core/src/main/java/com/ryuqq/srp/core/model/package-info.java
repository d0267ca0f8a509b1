/**
 * Core data model package.
 *
 * <p>This package defines the immutable records that flow between the orchestrators
 * and their single-purpose collaborators:</p>
 *
 * <h2>Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.srp.core.model.UserRecord} - User data (id, name, email, active)</li>
 *   <li>{@link com.ryuqq.srp.core.model.InvoiceRecord} - Raw or calculated invoice amount</li>
 *   <li>{@link com.ryuqq.srp.core.model.RenderedInvoice} - Invoice content in a concrete format</li>
 * </ul>
 *
 * <h2>Formats</h2>
 * <ul>
 *   <li>{@link com.ryuqq.srp.core.model.UserFormat} - CONSOLE, JSON</li>
 *   <li>{@link com.ryuqq.srp.core.model.InvoiceFormat} - HTML, PDF, CSV</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> State changes return new instances</li>
 *   <li><strong>Data only:</strong> No persistence, validation or presentation logic</li>
 *   <li><strong>Closed formats:</strong> Unknown format tags fail with UnsupportedFormatException</li>
 * </ul>
 *
 * @since 1.0.0
 * @author SRP Team
 */
package com.ryuqq.srp.core.model;
