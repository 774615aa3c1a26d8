package com.alonica.pos.domain.shift;

import java.util.Optional;

/**
 * ShiftRepository - 교대 근무 영속성 Port
 */
public interface ShiftRepository {

    Shift save(Shift shift);

    Optional<Shift> findById(Long shiftId);

    /**
     * 비관적 락으로 교대 조회 (마감, 현금 입출금 기록 시)
     */
    Optional<Shift> findByIdForUpdate(Long shiftId);

    Optional<Shift> findOpenByCashierId(Long cashierId);
}
