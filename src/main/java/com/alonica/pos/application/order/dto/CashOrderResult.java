package com.alonica.pos.application.order.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 현금 주문 결과 (받은 금액과 거스름돈 포함)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CashOrderResult {
    private OrderResult order;
    private long received;
    private long change;
}
