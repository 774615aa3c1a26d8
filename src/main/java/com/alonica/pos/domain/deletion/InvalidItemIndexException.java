package com.alonica.pos.domain.deletion;

import com.alonica.pos.common.exception.DomainException;
import com.alonica.pos.common.exception.ErrorCode;

/**
 * 주문 항목 인덱스가 범위를 벗어난 경우 (400)
 */
public class InvalidItemIndexException extends DomainException {

    public InvalidItemIndexException(Long orderId, int itemIndex, int itemCount) {
        super(ErrorCode.INVALID_ITEM_INDEX,
                "orderId=" + orderId + ", itemIndex=" + itemIndex + ", 항목 수: " + itemCount);
    }
}
