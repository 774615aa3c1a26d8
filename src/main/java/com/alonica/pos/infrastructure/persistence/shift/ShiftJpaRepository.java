package com.alonica.pos.infrastructure.persistence.shift;

import com.alonica.pos.domain.shift.Shift;
import com.alonica.pos.domain.shift.ShiftStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Shift JPA Repository
 */
public interface ShiftJpaRepository extends JpaRepository<Shift, Long> {

    /**
     * 비관적 락으로 교대 조회
     * 마감과 현금 입출금이 같은 행 잠금을 잡으므로 입출금은 마감 전 또는 후에만 반영된다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Shift s WHERE s.shiftId = :shiftId")
    Optional<Shift> findByIdForUpdate(@Param("shiftId") Long shiftId);

    Optional<Shift> findFirstByCashierIdAndStatusOrderByStartTimeDesc(Long cashierId, ShiftStatus status);
}
