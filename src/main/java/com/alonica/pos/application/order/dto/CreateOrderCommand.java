package com.alonica.pos.application.order.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 주문 생성 커맨드 (현금/QRIS 공용)
 *
 * received: 현금 주문에서 받은 금액 (null이면 total과 같다고 본다)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderCommand {
    private String customerName;
    private String tableNumber;
    private List<OrderLineCommand> items;
    private Long discount;
    private Long received;
}
