package com.alonica.pos.infrastructure.persistence.shift;

import com.alonica.pos.domain.shift.CashMovement;
import com.alonica.pos.domain.shift.CashMovementRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * MySQL 기반 현금 입출금 Repository 구현
 */
@Repository
public class MySQLCashMovementRepository implements CashMovementRepository {

    private final CashMovementJpaRepository cashMovementJpaRepository;

    public MySQLCashMovementRepository(CashMovementJpaRepository cashMovementJpaRepository) {
        this.cashMovementJpaRepository = cashMovementJpaRepository;
    }

    @Override
    public CashMovement save(CashMovement movement) {
        return cashMovementJpaRepository.save(movement);
    }

    @Override
    public List<CashMovement> findByShiftId(Long shiftId) {
        return cashMovementJpaRepository.findByShiftIdOrderByCreatedAtAsc(shiftId);
    }
}
