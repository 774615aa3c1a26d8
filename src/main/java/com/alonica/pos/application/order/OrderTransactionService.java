package com.alonica.pos.application.order;

import com.alonica.pos.domain.order.Order;
import com.alonica.pos.domain.order.OrderNotFoundException;
import com.alonica.pos.domain.order.OrderRepository;
import com.alonica.pos.domain.order.OrderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * OrderTransactionService - 주문 트랜잭션 처리 서비스 (Application 계층)
 *
 * OrderService 안에서 @Transactional 메서드를 직접 호출하면 프록시를 거치지 않아
 * 트랜잭션이 적용되지 않으므로(self-invocation) 2단계만 별도 서비스로 분리한다.
 *
 * OrderService (1단계 검증, 3단계 커밋 이후 훅)
 *     ↓
 * OrderTransactionService (2단계, @Transactional)
 */
@Service
public class OrderTransactionService {

    private static final Logger log = LoggerFactory.getLogger(OrderTransactionService.class);

    private final OrderRepository orderRepository;

    public OrderTransactionService(OrderRepository orderRepository) {
        this.orderRepository = orderRepository;
    }

    @Transactional
    public Order saveNewOrder(Order order) {
        Order saved = orderRepository.save(order);
        log.info("[OrderTransactionService] 주문 저장 - orderId={}, method={}, paymentStatus={}, total={}",
                saved.getOrderId(), saved.getPaymentMethod(), saved.getPaymentStatus(), saved.getTotal());
        return saved;
    }

    /**
     * 주문 상태 변경 (행 잠금 후 전진 전환만 허용)
     *
     * 잠금 안에서 전환을 검사하므로 같은 주문을 동시에 SERVED로 바꾸는 요청 중 하나만 성공한다.
     */
    @Transactional
    public Order changeStatus(Long orderId, OrderStatus target) {
        Order order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        OrderStatus previous = order.getOrderStatus();
        order.changeStatus(target);
        Order saved = orderRepository.save(order);
        log.info("[OrderTransactionService] 주문 상태 변경 - orderId={}, {} → {}", orderId, previous, target);
        return saved;
    }
}
