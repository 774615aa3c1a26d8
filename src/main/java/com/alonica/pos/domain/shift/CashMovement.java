package com.alonica.pos.domain.shift;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * CashMovement - 교대 중 수동 현금 입출금 (추가 전용)
 */
@Entity
@Table(name = "cash_movements", indexes = @Index(name = "idx_cash_movement_shift", columnList = "shift_id"))
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CashMovement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "cash_movement_id")
    private Long cashMovementId;

    @Column(name = "shift_id", nullable = false)
    private Long shiftId;

    @Column(name = "cashier_id", nullable = false)
    private Long cashierId;

    @Column(name = "type", nullable = false)
    @Enumerated(EnumType.STRING)
    private CashMovementType type;

    @Column(name = "amount", nullable = false)
    private Long amount;

    @Column(name = "description", nullable = false)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static CashMovement record(Shift shift, Long cashierId, CashMovementType type, long amount,
                                      String description) {
        shift.ensureOpen();
        if (amount <= 0) {
            throw new IllegalArgumentException("입출금 금액은 0보다 커야 합니다");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("입출금 사유는 필수입니다");
        }
        return CashMovement.builder()
                .shiftId(shift.getShiftId())
                .cashierId(cashierId)
                .type(type)
                .amount(amount)
                .description(description)
                .createdAt(LocalDateTime.now())
                .build();
    }
}
