package com.alonica.pos.common.exception;

/**
 * SystemException - 시스템/인프라 오류 예외
 *
 * 발생 상황:
 * - 결제 게이트웨이 호출 실패, 타임아웃
 * - 데이터베이스 연결 불가
 *
 * 특징:
 * - 클라이언트 재시도 가능성 있음
 * - 모니터링 필요
 */
public class SystemException extends BizException {

    public SystemException(ErrorCode errorCode) {
        super(errorCode);
    }

    public SystemException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public SystemException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }

    public SystemException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode, detailMessage, cause);
    }
}
