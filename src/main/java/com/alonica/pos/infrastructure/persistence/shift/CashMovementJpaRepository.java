package com.alonica.pos.infrastructure.persistence.shift;

import com.alonica.pos.domain.shift.CashMovement;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * CashMovement JPA Repository
 */
public interface CashMovementJpaRepository extends JpaRepository<CashMovement, Long> {

    List<CashMovement> findByShiftIdOrderByCreatedAtAsc(Long shiftId);
}
