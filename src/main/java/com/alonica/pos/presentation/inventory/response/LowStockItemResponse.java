package com.alonica.pos.presentation.inventory.response;

import com.alonica.pos.application.inventory.dto.LowStockResponse;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LowStockItemResponse {
    @JsonProperty("inventory_item_id")
    private Long inventoryItemId;

    private String name;

    private String category;

    @JsonProperty("current_stock")
    private BigDecimal currentStock;

    @JsonProperty("min_stock")
    private BigDecimal minStock;

    private String unit;

    public static LowStockItemResponse from(LowStockResponse item) {
        return LowStockItemResponse.builder()
                .inventoryItemId(item.getInventoryItemId())
                .name(item.getName())
                .category(item.getCategory())
                .currentStock(item.getCurrentStock())
                .minStock(item.getMinStock())
                .unit(item.getUnit())
                .build();
    }
}
