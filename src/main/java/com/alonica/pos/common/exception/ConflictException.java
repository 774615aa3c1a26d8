package com.alonica.pos.common.exception;

/**
 * ConflictException - 현재 상태와 요청이 충돌하는 경우 (409)
 *
 * 사용 예:
 * - 이미 결제된 오픈 빌을 다시 결제
 * - 이미 열린 교대(Shift)가 있는 캐셔가 새 교대를 시작
 * - 이미 처리된 삭제/환불 요청을 다시 결정
 * - 주문 상태를 역방향으로 변경
 */
public class ConflictException extends BizException {

    public ConflictException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ConflictException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
