package com.ryuqq.srp.core.exception;

/**
 * 업무 예외의 공통 상위 타입.
 *
 * <p>감지 지점에서 던져지고 오케스트레이터를 거쳐 호출자까지 그대로 전파됩니다.
 * 내부 복구나 재시도는 없습니다.</p>
 *
 * @author SRP Team
 * @since 1.0.0
 */
public abstract class SrpException extends RuntimeException {

    private final SrpErrorCode errorCode;

    protected SrpException(SrpErrorCode errorCode, Object... args) {
        super(errorCode.format(args));
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드
     */
    public SrpErrorCode getErrorCode() {
        return errorCode;
    }
}
