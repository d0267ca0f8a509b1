package com.ryuqq.srp.core.model;

import com.ryuqq.srp.core.exception.UnsupportedFormatException;

/**
 * 청구서 렌더링 형식.
 *
 * <p>지원 형식은 닫힌 집합이며, 알 수 없는 태그는 {@link UnsupportedFormatException}으로 거부됩니다.</p>
 *
 * @author SRP Team
 * @since 1.0.0
 */
public enum InvoiceFormat {

    HTML,

    PDF,

    CSV;

    /**
     * 형식 태그 조회.
     *
     * @return 대문자 태그 (예: "HTML")
     */
    public String tag() {
        return name();
    }

    /**
     * 태그 문자열을 InvoiceFormat으로 변환.
     *
     * <p>태그는 정확히 일치해야 합니다 (예: "PDF"는 허용, "pdf"는 거부).</p>
     *
     * @param tag 형식 태그 ("HTML", "PDF", "CSV")
     * @return InvoiceFormat
     * @throws UnsupportedFormatException 지원하지 않는 태그이거나 null인 경우
     */
    public static InvoiceFormat fromTag(String tag) {
        for (InvoiceFormat format : values()) {
            if (format.name().equals(tag)) {
                return format;
            }
        }
        throw new UnsupportedFormatException(tag);
    }
}
