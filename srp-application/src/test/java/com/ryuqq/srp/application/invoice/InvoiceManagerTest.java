package com.ryuqq.srp.application.invoice;

import com.ryuqq.srp.core.exception.UnsupportedFormatException;
import com.ryuqq.srp.core.model.InvoiceFormat;
import com.ryuqq.srp.core.model.InvoiceRecord;
import com.ryuqq.srp.core.model.RenderedInvoice;
import com.ryuqq.srp.core.spi.InvoiceCalculator;
import com.ryuqq.srp.core.spi.InvoiceRenderer;
import com.ryuqq.srp.core.spi.InvoiceSender;
import com.ryuqq.srp.testkit.contract.RecordingInvoiceSender;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * InvoiceManager 유닛 테스트.
 *
 * <p>calculate → render → send 순서와 실패 시 중단을 검증합니다.</p>
 *
 * @author SRP Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class InvoiceManagerTest {

    @Mock
    private InvoiceCalculator calculator;

    @Mock
    private InvoiceRenderer renderer;

    @Mock
    private InvoiceSender sender;

    @Test
    void processInvoice_계산_렌더링_발송_순서() {
        // given
        InvoiceRecord raw = InvoiceRecord.of(400.0);
        InvoiceRecord calculated = InvoiceRecord.of("440.0");
        RenderedInvoice rendered = new RenderedInvoice("content", InvoiceFormat.HTML);
        when(calculator.calculate(raw)).thenReturn(calculated);
        when(renderer.render(calculated, InvoiceFormat.HTML)).thenReturn(rendered);
        InvoiceManager manager = new InvoiceManager(calculator, renderer, sender);

        // when
        manager.processInvoice(raw, "java.customer@example.com", InvoiceFormat.HTML);

        // then
        InOrder inOrder = inOrder(calculator, renderer, sender);
        inOrder.verify(calculator).calculate(raw);
        inOrder.verify(renderer).render(calculated, InvoiceFormat.HTML);
        inOrder.verify(sender).send(rendered, "java.customer@example.com");
    }

    @Test
    void processInvoice_계산_실패시_이후_단계_실행_안함() {
        // given
        IllegalStateException failure = new IllegalStateException("calculation failed");
        when(calculator.calculate(any())).thenThrow(failure);
        InvoiceManager manager = new InvoiceManager(calculator, renderer, sender);

        // when & then
        assertThatThrownBy(() -> manager.processInvoice(InvoiceRecord.of(1.0), "a@b.c", InvoiceFormat.PDF))
            .isSameAs(failure);
        verifyNoInteractions(renderer, sender);
    }

    @Test
    void processInvoice_지원하지_않는_태그면_어떤_단계도_실행_안함() {
        // given
        InvoiceManager manager = new InvoiceManager(calculator, renderer, sender);

        // when & then
        assertThatThrownBy(() -> manager.processInvoice(InvoiceRecord.of(1.0), "a@b.c", "DOCX"))
            .isInstanceOf(UnsupportedFormatException.class);
        verifyNoInteractions(calculator, renderer, sender);
    }

    @Test
    void 기본_협력_객체로_400_HTML_처리() {
        // given
        RecordingInvoiceSender recorder = new RecordingInvoiceSender();
        InvoiceManager manager = new InvoiceManager(
            new SurchargeInvoiceCalculator(), new TextInvoiceRenderer(), recorder);

        // when
        manager.processInvoice(InvoiceRecord.of("400.0"), "java.customer@example.com", "HTML");
        manager.processInvoice(InvoiceRecord.of("400.0"), "another.java.customer@example.com", "PDF");

        // then
        assertThat(recorder.getDeliveries()).hasSize(2);
        RecordingInvoiceSender.Delivery first = recorder.getDeliveries().get(0);
        assertThat(first.destination()).isEqualTo("java.customer@example.com");
        assertThat(first.invoice().format()).isEqualTo(InvoiceFormat.HTML);
        assertThat(first.invoice().content()).isEqualTo("Rendered content for amount: 440.00 in HTML");
        assertThat(recorder.lastDelivery().invoice().format()).isEqualTo(InvoiceFormat.PDF);
    }

    @Test
    void withDefaults_예외없이_처리() {
        InvoiceManager manager = InvoiceManager.withDefaults();

        assertThatCode(() -> manager.processInvoice(InvoiceRecord.of(400.0), "java.customer@example.com", InvoiceFormat.CSV))
            .doesNotThrowAnyException();
    }

    @Test
    void 생성자_null_의존성이면_예외() {
        assertThatThrownBy(() -> new InvoiceManager(null, renderer, sender))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InvoiceManager(calculator, null, sender))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InvoiceManager(calculator, renderer, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
