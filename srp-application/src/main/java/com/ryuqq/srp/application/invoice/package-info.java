/**
 * Invoice workflow - 계산, 렌더링, 발송.
 *
 * <h2>핵심 클래스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.srp.application.invoice.InvoiceManager} - 처리 흐름 조정자</li>
 *   <li>{@link com.ryuqq.srp.application.invoice.SurchargeInvoiceCalculator} - 고정 할증 적용</li>
 *   <li>{@link com.ryuqq.srp.application.invoice.TextInvoiceRenderer} - 형식별 텍스트 렌더링</li>
 *   <li>{@link com.ryuqq.srp.application.invoice.LoggingInvoiceSender} - 로그 기반 발송 알림</li>
 *   <li>{@link com.ryuqq.srp.application.invoice.SurchargeConfig} - 할증률 설정</li>
 * </ul>
 *
 * @author SRP Team
 * @since 1.0.0
 */
package com.ryuqq.srp.application.invoice;
