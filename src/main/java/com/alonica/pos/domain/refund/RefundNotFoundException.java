package com.alonica.pos.domain.refund;

import com.alonica.pos.common.exception.DomainException;
import com.alonica.pos.common.exception.ErrorCode;

public class RefundNotFoundException extends DomainException {

    public RefundNotFoundException(Long refundId) {
        super(ErrorCode.REFUND_NOT_FOUND, "refundId=" + refundId);
    }
}
