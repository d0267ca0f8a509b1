package com.ryuqq.srp.application.invoice;

import com.ryuqq.srp.core.model.InvoiceFormat;
import com.ryuqq.srp.core.model.InvoiceRecord;
import com.ryuqq.srp.core.model.RenderedInvoice;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextInvoiceRendererTest {

    private final TextInvoiceRenderer renderer = new TextInvoiceRenderer();

    @ParameterizedTest
    @EnumSource(InvoiceFormat.class)
    void render_형식_태그_유지(InvoiceFormat format) {
        RenderedInvoice rendered = renderer.render(InvoiceRecord.of("440.00"), format);

        assertThat(rendered.format()).isEqualTo(format);
        assertThat(rendered.content()).isEqualTo("Rendered content for amount: 440.00 in " + format.tag());
    }

    @Test
    void 할증_후_금액도_소수점_두_자리로_표기() {
        InvoiceRecord calculated = new SurchargeInvoiceCalculator().calculate(InvoiceRecord.of("400.0"));

        RenderedInvoice rendered = renderer.render(calculated, InvoiceFormat.HTML);

        assertThat(calculated.amount().scale()).isEqualTo(3);
        assertThat(rendered.content()).isEqualTo("Rendered content for amount: 440.00 in HTML");
    }

    @Test
    void 금액은_HALF_UP으로_반올림() {
        assertThat(renderer.render(InvoiceRecord.of("12.345"), InvoiceFormat.CSV).content())
            .isEqualTo("Rendered content for amount: 12.35 in CSV");
        assertThat(renderer.render(InvoiceRecord.of("7"), InvoiceFormat.PDF).content())
            .isEqualTo("Rendered content for amount: 7.00 in PDF");
    }

    @Test
    void null_인자면_예외() {
        assertThatThrownBy(() -> renderer.render(null, InvoiceFormat.HTML))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> renderer.render(InvoiceRecord.of(1.0), null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
