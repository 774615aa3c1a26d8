package com.alonica.pos.domain.refund;

import java.util.List;

/**
 * RefundPolicy - 주문별 환불 한도 계산 (순수 도메인 로직)
 *
 * 환불 가능 금액 = 주문 총액 - Σ(APPROVED + COMPLETED 환불 금액)
 */
public final class RefundPolicy {

    private RefundPolicy() {
    }

    public static long committedAmount(List<Refund> refunds) {
        return refunds.stream()
                .filter(refund -> refund.getStatus().countsTowardLimit())
                .mapToLong(Refund::getRefundAmount)
                .sum();
    }

    public static long refundableAmount(long orderTotal, List<Refund> refunds) {
        return Math.max(0L, orderTotal - committedAmount(refunds));
    }

    /**
     * 요청 금액이 한도 안에 있는지 확인
     *
     * @throws RefundLimitExceededException 한도 초과
     */
    public static void ensureWithinLimit(Long orderId, long orderTotal, List<Refund> refunds, long requested) {
        long refundable = refundableAmount(orderTotal, refunds);
        if (requested > refundable) {
            throw new RefundLimitExceededException(orderId, requested, refundable);
        }
    }
}
