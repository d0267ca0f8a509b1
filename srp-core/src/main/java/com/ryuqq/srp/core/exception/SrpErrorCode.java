package com.ryuqq.srp.core.exception;

/**
 * 오류 코드.
 *
 * <p>각 코드는 고정된 코드 문자열과 {@link String#format} 메시지 템플릿을 가집니다.</p>
 *
 * @author SRP Team
 * @since 1.0.0
 */
public enum SrpErrorCode {

    USER_VALIDATION_FAILED("SRP-400", "Validation Error: %s"),

    NOT_FOUND("SRP-404", "%s with ID %s not found."),

    UNSUPPORTED_FORMAT("SRP-415", "Unsupported format: %s");

    private final String code;
    private final String messageTemplate;

    SrpErrorCode(String code, String messageTemplate) {
        this.code = code;
        this.messageTemplate = messageTemplate;
    }

    public String getCode() {
        return code;
    }

    public String getMessageTemplate() {
        return messageTemplate;
    }

    /**
     * 템플릿에 인자를 채운 메시지 생성.
     *
     * @param args 템플릿 인자
     * @return 완성된 메시지
     */
    public String format(Object... args) {
        return String.format(messageTemplate, args);
    }
}
