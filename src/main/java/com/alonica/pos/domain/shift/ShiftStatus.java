package com.alonica.pos.domain.shift;

/**
 * 교대 근무 상태
 */
public enum ShiftStatus {
    OPEN,
    CLOSED
}
