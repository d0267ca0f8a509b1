package com.ryuqq.srp.core.spi;

import com.ryuqq.srp.core.model.InvoiceRecord;

/**
 * Invoice total calculation SPI.
 *
 * <p>Changes only if tax or discount rules change.</p>
 *
 * @author SRP Team
 * @since 1.0.0
 */
public interface InvoiceCalculator {

    /**
     * Derives the final invoice from the raw one. The input is not modified.
     *
     * @param raw the raw invoice
     * @return a new invoice carrying the calculated amount
     * @throws IllegalArgumentException if raw is null
     */
    InvoiceRecord calculate(InvoiceRecord raw);
}
