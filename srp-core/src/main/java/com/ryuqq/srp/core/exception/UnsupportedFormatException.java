package com.ryuqq.srp.core.exception;

/**
 * 지원하지 않는 형식 태그가 요청된 경우.
 *
 * @author SRP Team
 * @since 1.0.0
 */
public class UnsupportedFormatException extends SrpException {

    private final String tag;

    /**
     * 생성자.
     *
     * @param tag 요청된 형식 태그 (null 가능)
     */
    public UnsupportedFormatException(String tag) {
        super(SrpErrorCode.UNSUPPORTED_FORMAT, tag);
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
