package com.ryuqq.srp.application.invoice;

import com.ryuqq.srp.core.model.InvoiceRecord;
import com.ryuqq.srp.core.spi.InvoiceCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 고정 할증률을 곱하는 계산기.
 *
 * <p>{@code amount * (1 + rate)}를 BigDecimal로 계산하므로 100.0은 정확히 110.0이 됩니다.
 * 입력 레코드는 변경되지 않습니다.</p>
 *
 * @author SRP Team
 * @since 1.0.0
 */
public final class SurchargeInvoiceCalculator implements InvoiceCalculator {

    private static final Logger log = LoggerFactory.getLogger(SurchargeInvoiceCalculator.class);

    private final SurchargeConfig config;

    public SurchargeInvoiceCalculator() {
        this(new SurchargeConfig());
    }

    /**
     * 생성자.
     *
     * @param config 할증 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public SurchargeInvoiceCalculator(SurchargeConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    @Override
    public InvoiceRecord calculate(InvoiceRecord raw) {
        if (raw == null) {
            throw new IllegalArgumentException("raw cannot be null");
        }
        InvoiceRecord calculated = InvoiceRecord.of(raw.amount().multiply(config.multiplier()));
        log.info("Calculated amount is {} (rate: {})", calculated.amount().toPlainString(), config.rate());
        return calculated;
    }
}
