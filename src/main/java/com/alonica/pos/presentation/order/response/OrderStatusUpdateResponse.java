package com.alonica.pos.presentation.order.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 주문 상태 변경 응답
 * warnings: 상태 변경은 성공했지만 후속 처리(재고 차감 등)가 실패한 경우의 안내
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderStatusUpdateResponse {
    private OrderResponse order;
    private List<String> warnings;
}
