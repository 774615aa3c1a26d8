package com.alonica.pos.application.order.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 주문 항목 커맨드 (Application layer 내부 DTO)
 * 가격은 서버에서 메뉴 기준으로 다시 계산하므로 메뉴 ID와 수량만 받는다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderLineCommand {
    private Long menuItemId;
    private Integer quantity;
    private String notes;
}
