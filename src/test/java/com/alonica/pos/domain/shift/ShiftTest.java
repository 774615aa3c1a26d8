package com.alonica.pos.domain.shift;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Shift 도메인 테스트")
class ShiftTest {

    private static ShiftReconciliation reconciliation(long systemCash, long finalCash) {
        return ShiftReconciliation.builder()
                .initialCash(100000L)
                .totalOrders(0)
                .totalRevenue(0L)
                .totalCashRevenue(0L)
                .totalNonCashRevenue(0L)
                .totalRefunds(0L)
                .totalCashIn(0L)
                .totalCashOut(0L)
                .totalExpenses(0L)
                .systemCash(systemCash)
                .finalCash(finalCash)
                .cashDifference(finalCash - systemCash)
                .build();
    }

    @Test
    @DisplayName("교대 마감 후 다시 마감하거나 입출금을 기록할 수 없음")
    void testCloseTwice() {
        // Given
        Shift shift = Shift.open(7L, 100000L).toBuilder().shiftId(3L).build();
        shift.close(reconciliation(100000L, 99000L), "kurang seribu", LocalDateTime.now());

        // Then
        assertEquals(ShiftStatus.CLOSED, shift.getStatus());
        assertEquals(-1000L, shift.getCashDifference());
        assertThrows(ShiftNotOpenException.class,
                () -> shift.close(reconciliation(100000L, 100000L), null, LocalDateTime.now()));
        assertThrows(ShiftNotOpenException.class,
                () -> CashMovement.record(shift, 7L, CashMovementType.CASH_IN, 1000L, "tambahan"));
    }

    @Test
    @DisplayName("감사 메모는 마감 이후에도 누적 추가 가능")
    void testAuditNotes() {
        // Given
        Shift shift = Shift.open(7L, 0L);
        shift.close(reconciliation(0L, 0L), null, LocalDateTime.now());

        // When
        shift.addAuditNote(1L, "cek ulang");
        shift.addAuditNote(1L, "oke");

        // Then
        assertTrue(shift.getAuditNotes().contains("cek ulang"));
        assertEquals(2, shift.getAuditNotes().split("\n").length);
        assertThrows(IllegalArgumentException.class, () -> shift.addAuditNote(1L, " "));
    }

    @Test
    @DisplayName("음수 시재금으로 교대를 시작할 수 없음")
    void testOpenNegativeCash() {
        assertThrows(IllegalArgumentException.class, () -> Shift.open(7L, -1L));
    }
}
