package com.alonica.pos.domain.order;

import com.alonica.pos.common.exception.ConflictException;
import com.alonica.pos.common.exception.ErrorCode;

/**
 * 이미 주방으로 전달되었거나 오픈 빌이 아닌 주문을 오픈 빌로 다루려 할 때 발생 (409)
 */
public class OpenBillNotOpenException extends ConflictException {

    public OpenBillNotOpenException(Long orderId) {
        super(ErrorCode.OPEN_BILL_NOT_OPEN, "orderId=" + orderId);
    }
}
