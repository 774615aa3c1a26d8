package com.alonica.pos.common.exception;

/**
 * DomainException - 도메인 규칙 위반 예외
 *
 * 역할:
 * - 비즈니스 도메인의 규칙 위반 시 발생
 * - 유효성 검증, 조회 실패 등
 * - 일반적으로 클라이언트 오류(4XX)로 응답
 *
 * 사용 예:
 * - OrderNotFoundException: 주문 조회 실패
 * - MenuItemUnavailableException: 주문할 수 없는 메뉴
 * - InvalidItemIndexException: 삭제 요청 항목 인덱스 범위 초과
 */
public class DomainException extends BizException {

    public DomainException(ErrorCode errorCode) {
        super(errorCode);
    }

    public DomainException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }

    public DomainException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }
}
