package com.ryuqq.srp.core.model;

/**
 * 특정 형식으로 렌더링된 청구서.
 *
 * <p>InvoiceRenderer가 생성하고 InvoiceSender가 한 번 소비한 뒤 버려집니다.</p>
 *
 * @param content 렌더링된 내용
 * @param format 렌더링 형식 (HTML, PDF, CSV)
 *
 * @author SRP Team
 * @since 1.0.0
 */
public record RenderedInvoice(String content, InvoiceFormat format) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException content 또는 format이 null인 경우
     */
    public RenderedInvoice {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (format == null) {
            throw new IllegalArgumentException("format cannot be null");
        }
    }
}
