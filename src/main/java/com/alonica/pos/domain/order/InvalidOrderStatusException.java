package com.alonica.pos.domain.order;

import com.alonica.pos.common.exception.ConflictException;
import com.alonica.pos.common.exception.ErrorCode;

/**
 * 주문 상태를 역방향 또는 같은 상태로 변경하려 할 때 발생하는 예외 (409)
 */
public class InvalidOrderStatusException extends ConflictException {

    public InvalidOrderStatusException(Long orderId, OrderStatus current, OrderStatus target) {
        super(ErrorCode.INVALID_ORDER_STATUS_TRANSITION,
                "orderId=" + orderId + ", 현재 상태: " + current + ", 요청 상태: " + target);
    }
}
