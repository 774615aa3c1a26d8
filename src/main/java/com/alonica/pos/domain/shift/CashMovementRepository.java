package com.alonica.pos.domain.shift;

import java.util.List;

/**
 * 현금 입출금 영속성 Port (추가 전용)
 */
public interface CashMovementRepository {

    CashMovement save(CashMovement movement);

    List<CashMovement> findByShiftId(Long shiftId);
}
