package com.alonica.pos.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 재고 사전 검증 응답
 * 부족해도 200으로 응답하며 success=false와 부족 목록을 담는다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockValidationResponse {
    private boolean success;

    @JsonProperty("insufficient_stock")
    private List<Shortage> insufficientStock;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Shortage {
        @JsonProperty("inventory_item_id")
        private Long inventoryItemId;

        private String name;

        private BigDecimal required;

        private BigDecimal available;
    }
}
