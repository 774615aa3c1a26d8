package com.alonica.pos.domain.refund;

import com.alonica.pos.common.exception.ConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RefundPolicy 테스트")
class RefundPolicyTest {

    private static Refund refund(long amount, RefundStatus status) {
        Refund refund = Refund.request(10L, amount, RefundType.CASH, "rusak", 7L);
        if (status == RefundStatus.APPROVED || status == RefundStatus.COMPLETED) {
            refund.approve(1L);
        }
        if (status == RefundStatus.COMPLETED) {
            refund.complete();
        }
        if (status == RefundStatus.REJECTED) {
            refund.reject(1L, "tidak valid");
        }
        return refund;
    }

    @Test
    @DisplayName("APPROVED와 COMPLETED만 한도 계산에 포함")
    void testRefundableAmount() {
        // Given
        List<Refund> refunds = List.of(
                refund(10000L, RefundStatus.APPROVED),
                refund(5000L, RefundStatus.COMPLETED),
                refund(7000L, RefundStatus.PENDING),
                refund(9000L, RefundStatus.REJECTED));

        // When & Then
        assertEquals(15000L, RefundPolicy.committedAmount(refunds));
        assertEquals(35000L, RefundPolicy.refundableAmount(50000L, refunds));
    }

    @Test
    @DisplayName("남은 한도를 넘는 요청은 거절")
    void testEnsureWithinLimit_Exceeded() {
        // Given
        List<Refund> refunds = List.of(refund(40000L, RefundStatus.COMPLETED));

        // When & Then
        assertDoesNotThrow(() -> RefundPolicy.ensureWithinLimit(10L, 50000L, refunds, 10000L));
        assertThrows(RefundLimitExceededException.class,
                () -> RefundPolicy.ensureWithinLimit(10L, 50000L, refunds, 10001L));
    }

    @Test
    @DisplayName("환불 상태 전환 - PENDING이 아니면 승인 불가")
    void testRefundTransition() {
        // Given
        Refund refund = refund(1000L, RefundStatus.REJECTED);

        // When & Then
        assertThrows(ConflictException.class, () -> refund.approve(1L));
        assertThrows(ConflictException.class, refund::complete);
    }
}
