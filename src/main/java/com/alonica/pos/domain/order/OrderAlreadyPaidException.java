package com.alonica.pos.domain.order;

import com.alonica.pos.common.exception.ConflictException;
import com.alonica.pos.common.exception.ErrorCode;

/**
 * 이미 결제된 주문을 다시 결제하거나 수정하려 할 때 발생 (409)
 */
public class OrderAlreadyPaidException extends ConflictException {

    public OrderAlreadyPaidException(Long orderId) {
        super(ErrorCode.ORDER_ALREADY_PAID, "orderId=" + orderId);
    }
}
