package com.alonica.pos.infrastructure.persistence.refund;

import com.alonica.pos.domain.refund.Refund;
import com.alonica.pos.domain.refund.RefundStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Refund JPA Repository
 */
public interface RefundJpaRepository extends JpaRepository<Refund, Long> {

    List<Refund> findByOrderIdOrderByCreatedAtAsc(Long orderId);

    List<Refund> findByRequestedByAndStatusAndCreatedAtBetween(Long requestedBy, RefundStatus status,
                                                               LocalDateTime from, LocalDateTime to);
}
