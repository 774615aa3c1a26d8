package com.alonica.pos.domain.shift;

import com.alonica.pos.common.exception.DomainException;
import com.alonica.pos.common.exception.ErrorCode;

public class ShiftNotFoundException extends DomainException {

    public ShiftNotFoundException(Long shiftId) {
        super(ErrorCode.SHIFT_NOT_FOUND, "shiftId=" + shiftId);
    }

    public ShiftNotFoundException(String detailMessage) {
        super(ErrorCode.SHIFT_NOT_FOUND, detailMessage);
    }
}
