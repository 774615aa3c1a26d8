package com.alonica.pos.domain.refund;

import com.alonica.pos.common.exception.DomainException;
import com.alonica.pos.common.exception.ErrorCode;

/**
 * 누적 환불 금액이 주문 총액을 넘는 경우 (400)
 */
public class RefundLimitExceededException extends DomainException {

    public RefundLimitExceededException(Long orderId, long requested, long refundable) {
        super(ErrorCode.REFUND_LIMIT_EXCEEDED,
                "orderId=" + orderId + ", 요청 금액: " + requested + ", 환불 가능 금액: " + refundable);
    }
}
