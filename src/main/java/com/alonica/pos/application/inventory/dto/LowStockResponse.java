package com.alonica.pos.application.inventory.dto;

import com.alonica.pos.domain.inventory.InventoryItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 재고 부족 재료 조회 응답 항목
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LowStockResponse {
    private Long inventoryItemId;
    private String name;
    private String category;
    private BigDecimal currentStock;
    private BigDecimal minStock;
    private String unit;

    public static LowStockResponse from(InventoryItem item) {
        return LowStockResponse.builder()
                .inventoryItemId(item.getInventoryItemId())
                .name(item.getName())
                .category(item.getCategory())
                .currentStock(item.getCurrentStock())
                .minStock(item.getMinStock())
                .unit(item.getUnit())
                .build();
    }
}
