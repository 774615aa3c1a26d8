package com.alonica.pos.domain.shift;

import com.alonica.pos.common.exception.ConflictException;
import com.alonica.pos.common.exception.ErrorCode;

/**
 * 마감된 교대에 입출금/마감을 시도할 때 발생 (409)
 */
public class ShiftNotOpenException extends ConflictException {

    public ShiftNotOpenException(Long shiftId) {
        super(ErrorCode.SHIFT_NOT_OPEN, "shiftId=" + shiftId);
    }
}
