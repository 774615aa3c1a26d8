package com.alonica.pos.infrastructure.persistence.refund;

import com.alonica.pos.domain.refund.Refund;
import com.alonica.pos.domain.refund.RefundRepository;
import com.alonica.pos.domain.refund.RefundStatus;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * InMemoryRefundRepository - 환불 저장소 구현체 (인메모리)
 */
@Repository
public class InMemoryRefundRepository implements RefundRepository {

    private final ConcurrentHashMap<Long, Refund> refunds = new ConcurrentHashMap<>();
    private long refundIdSequence = 0L;

    @Override
    public synchronized Refund save(Refund refund) {
        Refund saved = refund.getRefundId() == null
                ? refund.toBuilder().refundId(++refundIdSequence).build()
                : refund;
        refunds.put(saved.getRefundId(), saved);
        return saved;
    }

    @Override
    public Optional<Refund> findById(Long refundId) {
        return Optional.ofNullable(refunds.get(refundId));
    }

    @Override
    public List<Refund> findByOrderId(Long orderId) {
        return refunds.values().stream()
                .filter(refund -> refund.getOrderId().equals(orderId))
                .sorted(Comparator.comparing(Refund::getRefundId))
                .collect(Collectors.toList());
    }

    @Override
    public List<Refund> findByRequestedByAndStatusBetween(Long requestedBy, RefundStatus status,
                                                          LocalDateTime from, LocalDateTime to) {
        return refunds.values().stream()
                .filter(refund -> refund.getRequestedBy().equals(requestedBy))
                .filter(refund -> refund.getStatus() == status)
                .filter(refund -> !refund.getCreatedAt().isBefore(from) && !refund.getCreatedAt().isAfter(to))
                .collect(Collectors.toList());
    }
}
