package com.alonica.pos.infrastructure.persistence.shift;

import com.alonica.pos.domain.shift.Shift;
import com.alonica.pos.domain.shift.ShiftRepository;
import com.alonica.pos.domain.shift.ShiftStatus;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * MySQL 기반 Shift Repository 구현
 */
@Repository
public class MySQLShiftRepository implements ShiftRepository {

    private final ShiftJpaRepository shiftJpaRepository;

    public MySQLShiftRepository(ShiftJpaRepository shiftJpaRepository) {
        this.shiftJpaRepository = shiftJpaRepository;
    }

    @Override
    public Shift save(Shift shift) {
        return shiftJpaRepository.save(shift);
    }

    @Override
    public Optional<Shift> findById(Long shiftId) {
        return shiftJpaRepository.findById(shiftId);
    }

    @Override
    @Transactional
    public Optional<Shift> findByIdForUpdate(Long shiftId) {
        return shiftJpaRepository.findByIdForUpdate(shiftId);
    }

    @Override
    public Optional<Shift> findOpenByCashierId(Long cashierId) {
        return shiftJpaRepository.findFirstByCashierIdAndStatusOrderByStartTimeDesc(cashierId, ShiftStatus.OPEN);
    }
}
