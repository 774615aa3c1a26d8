package com.alonica.pos.domain.order.event;

import com.alonica.pos.domain.order.OrderItem;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 서빙 완료 이벤트
 * 주문 상태가 SERVED로 커밋된 뒤 재고 차감 훅에 전달된다.
 */
@Getter
@ToString
public class OrderServedEvent {

    private final Long orderId;
    private final List<OrderItem> items;
    private final LocalDateTime occurredAt;

    public OrderServedEvent(Long orderId, List<OrderItem> items) {
        this.orderId = orderId;
        this.items = List.copyOf(items);
        this.occurredAt = LocalDateTime.now();
    }
}
