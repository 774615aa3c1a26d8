package com.alonica.pos.domain.refund;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 환불 영속성 Port
 */
public interface RefundRepository {

    Refund save(Refund refund);

    Optional<Refund> findById(Long refundId);

    List<Refund> findByOrderId(Long orderId);

    /**
     * 요청자가 기간 [from, to]에 요청했고 지정 상태인 환불
     */
    List<Refund> findByRequestedByAndStatusBetween(Long requestedBy, RefundStatus status,
                                                   LocalDateTime from, LocalDateTime to);
}
