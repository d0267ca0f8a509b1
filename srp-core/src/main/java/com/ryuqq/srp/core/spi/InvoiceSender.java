package com.ryuqq.srp.core.spi;

import com.ryuqq.srp.core.model.RenderedInvoice;

/**
 * Invoice delivery SPI. No retry and no failure path are modeled.
 *
 * @author SRP Team
 * @since 1.0.0
 */
public interface InvoiceSender {

    /**
     * @param invoice the rendered invoice
     * @param destination the recipient, e.g. a customer email address
     * @throws IllegalArgumentException if invoice is null or destination is blank
     */
    void send(RenderedInvoice invoice, String destination);
}
