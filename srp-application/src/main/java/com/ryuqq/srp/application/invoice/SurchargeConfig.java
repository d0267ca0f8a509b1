package com.ryuqq.srp.application.invoice;

import java.math.BigDecimal;

/**
 * 할증 계산 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>rate: 금액에 곱해지는 할증률 (기본 0.10 = 10%)</li>
 * </ul>
 *
 * @author SRP Team
 * @since 1.0.0
 * @param rate 할증률 (null 불가, 0 이상)
 */
public record SurchargeConfig(BigDecimal rate) {

    /**
     * 기본 할증률 10%.
     */
    public static final BigDecimal DEFAULT_RATE = new BigDecimal("0.10");

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: rate=0.10</p>
     */
    public SurchargeConfig() {
        this(DEFAULT_RATE);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SurchargeConfig {
        if (rate == null) {
            throw new IllegalArgumentException("rate cannot be null");
        }
        if (rate.signum() < 0) {
            throw new IllegalArgumentException(
                "rate must not be negative (current: " + rate + ")"
            );
        }
    }

    /**
     * rate만 변경한 새 인스턴스 생성.
     *
     * @param rate 새로운 할증률
     * @return 새 SurchargeConfig 인스턴스
     */
    public SurchargeConfig withRate(BigDecimal rate) {
        return new SurchargeConfig(rate);
    }

    /**
     * 금액에 곱할 배수 (1 + rate).
     *
     * @return 배수
     */
    public BigDecimal multiplier() {
        return BigDecimal.ONE.add(rate);
    }
}
