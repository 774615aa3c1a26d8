package com.alonica.pos.infrastructure.persistence.shift;

import com.alonica.pos.domain.shift.CashMovement;
import com.alonica.pos.domain.shift.CashMovementRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * InMemoryCashMovementRepository - 현금 입출금 구현체 (인메모리)
 */
@Repository
public class InMemoryCashMovementRepository implements CashMovementRepository {

    private final ConcurrentHashMap<Long, CashMovement> movements = new ConcurrentHashMap<>();
    private long movementIdSequence = 0L;

    @Override
    public synchronized CashMovement save(CashMovement movement) {
        CashMovement saved = movement.getCashMovementId() == null
                ? movement.toBuilder().cashMovementId(++movementIdSequence).build()
                : movement;
        movements.put(saved.getCashMovementId(), saved);
        return saved;
    }

    @Override
    public List<CashMovement> findByShiftId(Long shiftId) {
        return movements.values().stream()
                .filter(movement -> movement.getShiftId().equals(shiftId))
                .sorted(Comparator.comparing(CashMovement::getCashMovementId))
                .collect(Collectors.toList());
    }
}
