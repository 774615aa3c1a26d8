package com.alonica.pos.domain.order;

import com.alonica.pos.common.exception.DomainException;
import com.alonica.pos.common.exception.ErrorCode;

/**
 * 주문을 찾을 수 없을 때 발생하는 예외 (404)
 */
public class OrderNotFoundException extends DomainException {

    public OrderNotFoundException(Long orderId) {
        super(ErrorCode.ORDER_NOT_FOUND, "orderId=" + orderId);
    }

    public OrderNotFoundException(String gatewayOrderId) {
        super(ErrorCode.ORDER_NOT_FOUND, "gatewayOrderId=" + gatewayOrderId);
    }
}
