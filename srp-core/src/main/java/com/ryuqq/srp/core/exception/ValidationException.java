package com.ryuqq.srp.core.exception;

/**
 * 필드 값이 업무 규칙을 위반한 경우.
 *
 * @author SRP Team
 * @since 1.0.0
 */
public class ValidationException extends SrpException {

    private final String field;

    /**
     * 생성자.
     *
     * @param field 위반한 필드명 (예: name, email)
     * @param detail 위반 내용
     */
    public ValidationException(String field, String detail) {
        super(SrpErrorCode.USER_VALIDATION_FAILED, detail);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
