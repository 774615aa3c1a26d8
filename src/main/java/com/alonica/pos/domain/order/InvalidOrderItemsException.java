package com.alonica.pos.domain.order;

import com.alonica.pos.common.exception.DomainException;
import com.alonica.pos.common.exception.ErrorCode;

/**
 * 주문 항목이 비게 되는 요청 (400)
 */
public class InvalidOrderItemsException extends DomainException {

    public InvalidOrderItemsException(String detailMessage) {
        super(ErrorCode.ORDER_ITEMS_EMPTY, detailMessage);
    }
}
