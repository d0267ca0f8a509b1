package com.ryuqq.srp.core.spi;

import com.ryuqq.srp.core.model.InvoiceFormat;
import com.ryuqq.srp.core.model.InvoiceRecord;
import com.ryuqq.srp.core.model.RenderedInvoice;

/**
 * Invoice rendering SPI. Changes only if a format's layout changes.
 *
 * @author SRP Team
 * @since 1.0.0
 */
public interface InvoiceRenderer {

    /**
     * @param invoice the calculated invoice
     * @param format the target format
     * @return the rendered invoice, tagged with {@code format}
     * @throws IllegalArgumentException if invoice or format is null
     */
    RenderedInvoice render(InvoiceRecord invoice, InvoiceFormat format);
}
