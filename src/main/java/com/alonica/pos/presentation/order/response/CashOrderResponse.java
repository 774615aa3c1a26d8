package com.alonica.pos.presentation.order.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 현금 주문 생성 응답 (거스름돈 포함)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CashOrderResponse {
    private OrderResponse order;
    private Long received;
    private Long change;
}
