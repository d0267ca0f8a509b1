package com.ryuqq.srp.core.model;

import com.ryuqq.srp.core.exception.UnsupportedFormatException;

/**
 * 사용자 정보 표현 형식.
 *
 * <ul>
 *   <li>CONSOLE: 여러 줄의 고정 레이아웃 텍스트</li>
 *   <li>JSON: 동일한 네 필드의 JSON 객체</li>
 * </ul>
 *
 * @author SRP Team
 * @since 1.0.0
 */
public enum UserFormat {

    CONSOLE("console"),

    JSON("json");

    private final String tag;

    UserFormat(String tag) {
        this.tag = tag;
    }

    /**
     * 형식 태그 조회.
     *
     * @return 소문자 태그 (예: "console")
     */
    public String tag() {
        return tag;
    }

    /**
     * 태그 문자열을 UserFormat으로 변환.
     *
     * <p>태그는 정확히 일치해야 합니다. 대소문자나 공백이 다르면 지원하지 않는 태그로 취급합니다.</p>
     *
     * @param tag 형식 태그 ("console" 또는 "json")
     * @return UserFormat
     * @throws UnsupportedFormatException 지원하지 않는 태그이거나 null인 경우
     */
    public static UserFormat fromTag(String tag) {
        for (UserFormat format : values()) {
            if (format.tag.equals(tag)) {
                return format;
            }
        }
        throw new UnsupportedFormatException(tag);
    }
}
