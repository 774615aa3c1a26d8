package com.alonica.pos.application.inventory.dto;

import com.alonica.pos.domain.inventory.StockShortage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 재고 검증/차감 결과
 *
 * - success: 모든 재료가 충분하고 (차감 시) 차감이 커밋됨
 * - insufficientStock: 부족한 재료 목록
 * - deductions: 실제 차감 내역 (검증만 한 경우 비어 있음)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockDeductionResult {
    private boolean success;
    private List<StockShortage> insufficientStock;
    private List<Deduction> deductions;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Deduction {
        private Long inventoryItemId;
        private String name;
        private BigDecimal deducted;
        private BigDecimal newStock;
    }

    public static StockDeductionResult failed(List<StockShortage> shortages) {
        return StockDeductionResult.builder()
                .success(false)
                .insufficientStock(List.copyOf(shortages))
                .deductions(List.of())
                .build();
    }

    public String describeShortages() {
        if (insufficientStock == null || insufficientStock.isEmpty()) {
            return "부족한 재료 없음";
        }
        return insufficientStock.stream()
                .map(s -> s.getName() + "(필요 " + s.getRequired().toPlainString()
                        + ", 재고 " + s.getAvailable().toPlainString() + ")")
                .collect(Collectors.joining(", "));
    }
}
