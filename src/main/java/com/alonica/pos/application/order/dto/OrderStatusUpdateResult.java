package com.alonica.pos.application.order.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 주문 상태 변경 결과
 * warnings: 커밋 이후 부가 작업(재고 차감 등)의 실패 메시지. 상태 변경 자체는 성공한 것이다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderStatusUpdateResult {
    private OrderResult order;
    private List<String> warnings;
}
