package com.alonica.pos.common.exception;

/**
 * BizException - 비즈니스 예외의 최상위 클래스
 *
 * 역할:
 * - 모든 비즈니스 예외의 기본 클래스
 * - 에러 코드와 HTTP 상태 정보 포함
 * - GlobalExceptionHandler가 이 타입 하나로 응답을 변환
 *
 * 예외 계층:
 * BizException (최상위)
 * ├─ DomainException (도메인 규칙 위반, 4XX)
 * ├─ ConflictException (상태 충돌, 409)
 * ├─ ApplicationException (비즈니스 프로세스 실패, 5XX)
 * └─ SystemException (시스템/외부 연동 오류)
 */
public abstract class BizException extends RuntimeException {

    private final ErrorCode errorCode;

    protected BizException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    protected BizException(ErrorCode errorCode, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
    }

    protected BizException(ErrorCode errorCode, String detailMessage) {
        super(errorCode.getMessage() + " | " + detailMessage);
        this.errorCode = errorCode;
    }

    protected BizException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode.getMessage() + " | " + detailMessage, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getStatusCode() {
        return errorCode.getStatusCode();
    }

    public String getErrorCodeValue() {
        return errorCode.getCode();
    }
}
