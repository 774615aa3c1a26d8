package com.alonica.pos.infrastructure.persistence.shift;

import com.alonica.pos.domain.shift.Shift;
import com.alonica.pos.domain.shift.ShiftRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * InMemoryShiftRepository - 교대 저장소 구현체 (인메모리)
 */
@Repository
public class InMemoryShiftRepository implements ShiftRepository {

    private final ConcurrentHashMap<Long, Shift> shifts = new ConcurrentHashMap<>();
    private long shiftIdSequence = 0L;

    @Override
    public Shift save(Shift shift) {
        if (shift.getShiftId() == null) {
            synchronized (this) {
                Shift saved = shift.toBuilder().shiftId(++shiftIdSequence).build();
                shifts.put(saved.getShiftId(), saved);
                return saved;
            }
        }
        shifts.put(shift.getShiftId(), shift);
        return shift;
    }

    @Override
    public Optional<Shift> findById(Long shiftId) {
        return Optional.ofNullable(shifts.get(shiftId));
    }

    @Override
    public Optional<Shift> findByIdForUpdate(Long shiftId) {
        return findById(shiftId);
    }

    @Override
    public Optional<Shift> findOpenByCashierId(Long cashierId) {
        return shifts.values().stream()
                .filter(shift -> shift.isOwnedBy(cashierId) && shift.isOpen())
                .max(Comparator.comparing(Shift::getStartTime));
    }
}
