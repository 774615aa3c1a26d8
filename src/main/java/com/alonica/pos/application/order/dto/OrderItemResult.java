package com.alonica.pos.application.order.dto;

import com.alonica.pos.domain.order.OrderItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 주문 항목 결과 (Application layer 내부 DTO)
 * index는 삭제 요청에서 사용하는 0부터 시작하는 위치
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderItemResult {
    private int index;
    private Long menuItemId;
    private String name;
    private Long unitPrice;
    private Integer quantity;
    private String notes;
    private Long lineTotal;

    public static OrderItemResult of(int index, OrderItem item) {
        return OrderItemResult.builder()
                .index(index)
                .menuItemId(item.getMenuItemId())
                .name(item.getName())
                .unitPrice(item.getUnitPrice())
                .quantity(item.getQuantity())
                .notes(item.getNotes())
                .lineTotal(item.getLineTotal())
                .build();
    }
}
