package com.alonica.pos.domain.shift;

import com.alonica.pos.common.exception.ConflictException;
import com.alonica.pos.common.exception.ErrorCode;

/**
 * 이미 열린 교대가 있는 캐셔가 교대를 시작할 때 발생 (409)
 */
public class ShiftAlreadyOpenException extends ConflictException {

    public ShiftAlreadyOpenException(Long cashierId, Long openShiftId) {
        super(ErrorCode.SHIFT_ALREADY_OPEN, "cashierId=" + cashierId + ", openShiftId=" + openShiftId);
    }
}
