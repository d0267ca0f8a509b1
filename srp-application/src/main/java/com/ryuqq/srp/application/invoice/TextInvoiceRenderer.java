package com.ryuqq.srp.application.invoice;

import com.ryuqq.srp.core.model.InvoiceFormat;
import com.ryuqq.srp.core.model.InvoiceRecord;
import com.ryuqq.srp.core.model.RenderedInvoice;
import com.ryuqq.srp.core.spi.InvoiceRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.RoundingMode;

/**
 * 텍스트 기반 청구서 렌더러.
 *
 * <p>내용 형식: {@code Rendered content for amount: <amount> in <FORMAT>}</p>
 *
 * <p>금액은 소수점 두 자리로 표기합니다 (HALF_UP).</p>
 *
 * @author SRP Team
 * @since 1.0.0
 */
public final class TextInvoiceRenderer implements InvoiceRenderer {

    private static final Logger log = LoggerFactory.getLogger(TextInvoiceRenderer.class);

    private static final int AMOUNT_SCALE = 2;

    @Override
    public RenderedInvoice render(InvoiceRecord invoice, InvoiceFormat format) {
        if (invoice == null) {
            throw new IllegalArgumentException("invoice cannot be null");
        }
        if (format == null) {
            throw new IllegalArgumentException("format cannot be null");
        }
        String amount = invoice.amount().setScale(AMOUNT_SCALE, RoundingMode.HALF_UP).toPlainString();
        String content = "Rendered content for amount: " + amount + " in " + format.tag();
        log.info("Rendered invoice to {} format: \"{}\"", format, content);
        return new RenderedInvoice(content, format);
    }
}
