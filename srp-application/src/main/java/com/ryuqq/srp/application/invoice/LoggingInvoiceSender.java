package com.ryuqq.srp.application.invoice;

import com.ryuqq.srp.core.model.RenderedInvoice;
import com.ryuqq.srp.core.spi.InvoiceSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 로그 출력으로 발송을 알리는 InvoiceSender.
 *
 * <p>실제 전송은 없으며 INFO 로그가 관찰 가능한 유일한 효과입니다.</p>
 *
 * @author SRP Team
 * @since 1.0.0
 */
public final class LoggingInvoiceSender implements InvoiceSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingInvoiceSender.class);

    @Override
    public void send(RenderedInvoice invoice, String destination) {
        if (invoice == null) {
            throw new IllegalArgumentException("invoice cannot be null");
        }
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("destination cannot be null or blank");
        }
        log.info("Sending {} invoice to {}", invoice.format(), destination);
        log.info("Content sent: \"{}\"", invoice.content());
    }
}
