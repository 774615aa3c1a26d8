package com.alonica.pos.infrastructure.persistence.refund;

import com.alonica.pos.domain.refund.Refund;
import com.alonica.pos.domain.refund.RefundRepository;
import com.alonica.pos.domain.refund.RefundStatus;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 환불 Repository 구현
 */
@Repository
public class MySQLRefundRepository implements RefundRepository {

    private final RefundJpaRepository refundJpaRepository;

    public MySQLRefundRepository(RefundJpaRepository refundJpaRepository) {
        this.refundJpaRepository = refundJpaRepository;
    }

    @Override
    public Refund save(Refund refund) {
        return refundJpaRepository.save(refund);
    }

    @Override
    public Optional<Refund> findById(Long refundId) {
        return refundJpaRepository.findById(refundId);
    }

    @Override
    public List<Refund> findByOrderId(Long orderId) {
        return refundJpaRepository.findByOrderIdOrderByCreatedAtAsc(orderId);
    }

    @Override
    public List<Refund> findByRequestedByAndStatusBetween(Long requestedBy, RefundStatus status,
                                                          LocalDateTime from, LocalDateTime to) {
        return refundJpaRepository.findByRequestedByAndStatusAndCreatedAtBetween(requestedBy, status, from, to);
    }
}
