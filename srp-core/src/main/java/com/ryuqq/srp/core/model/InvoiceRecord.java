package com.ryuqq.srp.core.model;

import java.math.BigDecimal;

/**
 * 청구서 원천 데이터.
 *
 * <p>금액 계산은 {@code InvoiceCalculator}가 새 InvoiceRecord를 반환하는 순수 변환으로 수행하며,
 * 입력 레코드는 변경되지 않습니다.</p>
 *
 * @param amount 청구 금액 (null 불가)
 *
 * @author SRP Team
 * @since 1.0.0
 */
public record InvoiceRecord(BigDecimal amount) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException amount가 null인 경우
     */
    public InvoiceRecord {
        if (amount == null) {
            throw new IllegalArgumentException("amount cannot be null");
        }
    }

    public static InvoiceRecord of(BigDecimal amount) {
        return new InvoiceRecord(amount);
    }

    /**
     * double 금액으로 생성.
     *
     * <p>{@link BigDecimal#valueOf(double)}를 사용하므로 100.0은 "100.0"으로 표현됩니다.</p>
     *
     * @param amount 청구 금액
     * @return InvoiceRecord 인스턴스
     */
    public static InvoiceRecord of(double amount) {
        return new InvoiceRecord(BigDecimal.valueOf(amount));
    }

    public static InvoiceRecord of(String amount) {
        if (amount == null) {
            throw new IllegalArgumentException("amount cannot be null");
        }
        return new InvoiceRecord(new BigDecimal(amount));
    }
}
