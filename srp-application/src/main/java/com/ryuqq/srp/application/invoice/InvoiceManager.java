package com.ryuqq.srp.application.invoice;

import com.ryuqq.srp.core.exception.UnsupportedFormatException;
import com.ryuqq.srp.core.model.InvoiceFormat;
import com.ryuqq.srp.core.model.InvoiceRecord;
import com.ryuqq.srp.core.model.RenderedInvoice;
import com.ryuqq.srp.core.spi.InvoiceCalculator;
import com.ryuqq.srp.core.spi.InvoiceRenderer;
import com.ryuqq.srp.core.spi.InvoiceSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 청구서 처리 조정자.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. calculator.calculate(raw)        → 계산된 InvoiceRecord
 * 2. renderer.render(calculated, fmt) → RenderedInvoice
 * 3. sender.send(rendered, dest)      → 발송 알림
 * </pre>
 *
 * <p>반환값 없이 효과만 가지며, 어느 단계든 실패하면 이후 단계는 실행되지 않습니다.</p>
 *
 * @author SRP Team
 * @since 1.0.0
 */
public final class InvoiceManager {

    private static final Logger log = LoggerFactory.getLogger(InvoiceManager.class);

    private final InvoiceCalculator calculator;
    private final InvoiceRenderer renderer;
    private final InvoiceSender sender;

    /**
     * 생성자.
     *
     * @param calculator 계산기
     * @param renderer 렌더러
     * @param sender 발송기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public InvoiceManager(InvoiceCalculator calculator, InvoiceRenderer renderer, InvoiceSender sender) {
        if (calculator == null) {
            throw new IllegalArgumentException("calculator cannot be null");
        }
        if (renderer == null) {
            throw new IllegalArgumentException("renderer cannot be null");
        }
        if (sender == null) {
            throw new IllegalArgumentException("sender cannot be null");
        }
        this.calculator = calculator;
        this.renderer = renderer;
        this.sender = sender;
    }

    /**
     * 기본 협력 객체로 구성된 InvoiceManager 생성.
     *
     * @return 10% 할증, 텍스트 렌더링, 로그 발송을 사용하는 InvoiceManager
     */
    public static InvoiceManager withDefaults() {
        return new InvoiceManager(
            new SurchargeInvoiceCalculator(),
            new TextInvoiceRenderer(),
            new LoggingInvoiceSender()
        );
    }

    /**
     * 청구서 처리.
     *
     * @param raw 원천 청구서
     * @param destination 수신자 (예: 고객 이메일)
     * @param format 렌더링 형식
     * @throws IllegalArgumentException raw 또는 format이 null인 경우
     */
    public void processInvoice(InvoiceRecord raw, String destination, InvoiceFormat format) {
        if (raw == null) {
            throw new IllegalArgumentException("raw cannot be null");
        }
        if (format == null) {
            throw new IllegalArgumentException("format cannot be null");
        }
        log.info("Starting invoice processing for {}", destination);

        // 1. 금액 계산
        InvoiceRecord calculated = calculator.calculate(raw);

        // 2. 지정 형식으로 렌더링
        RenderedInvoice rendered = renderer.render(calculated, format);

        // 3. 발송
        sender.send(rendered, destination);

        log.info("Invoice processing finished for {}", destination);
    }

    /**
     * 형식 태그로 청구서 처리.
     *
     * <p>태그는 어떤 단계보다 먼저 해석되므로, 지원하지 않는 태그면 계산도 수행되지 않습니다.</p>
     *
     * @param raw 원천 청구서
     * @param destination 수신자
     * @param formatTag 형식 태그 (HTML, PDF, CSV)
     * @throws UnsupportedFormatException 지원하지 않는 태그인 경우
     */
    public void processInvoice(InvoiceRecord raw, String destination, String formatTag) {
        processInvoice(raw, destination, InvoiceFormat.fromTag(formatTag));
    }
}
