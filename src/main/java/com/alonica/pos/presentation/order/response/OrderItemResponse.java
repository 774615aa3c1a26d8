package com.alonica.pos.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 주문 항목 응답 DTO
 * index는 삭제 요청 시 사용하는 0부터 시작하는 위치
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderItemResponse {
    private Integer index;

    @JsonProperty("menu_item_id")
    private Long menuItemId;

    private String name;

    @JsonProperty("unit_price")
    private Long unitPrice;

    private Integer quantity;

    private String notes;

    @JsonProperty("line_total")
    private Long lineTotal;
}
