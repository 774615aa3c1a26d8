package com.alonica.pos.application.openbill;

import com.alonica.pos.domain.order.Order;
import com.alonica.pos.domain.order.OrderItem;
import com.alonica.pos.domain.order.OrderNotFoundException;
import com.alonica.pos.domain.order.OrderRepository;
import com.alonica.pos.domain.order.PaymentMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * OpenBillTransactionService - 오픈 빌 변경 트랜잭션 (2단계)
 *
 * 모든 변경은 주문 행을 비관적 락으로 읽은 뒤 도메인 메서드로 검증/변경한다.
 */
@Service
public class OpenBillTransactionService {

    private static final Logger log = LoggerFactory.getLogger(OpenBillTransactionService.class);

    private final OrderRepository orderRepository;

    public OpenBillTransactionService(OrderRepository orderRepository) {
        this.orderRepository = orderRepository;
    }

    @Transactional
    public Order create(Order openBill) {
        Order saved = orderRepository.save(openBill);
        log.info("[OpenBillTransactionService] 오픈 빌 생성 - orderId={}, table={}, total={}",
                saved.getOrderId(), saved.getTableNumber(), saved.getTotal());
        return saved;
    }

    @Transactional
    public Order append(Long orderId, List<OrderItem> items) {
        Order order = lock(orderId);
        order.appendItems(items);
        log.info("[OpenBillTransactionService] 오픈 빌 항목 추가 - orderId={}, added={}, total={}",
                orderId, items.size(), order.getTotal());
        return orderRepository.save(order);
    }

    @Transactional
    public Order replace(Long orderId, List<OrderItem> items) {
        Order order = lock(orderId);
        order.replaceItems(items);
        log.info("[OpenBillTransactionService] 오픈 빌 항목 교체 - orderId={}, items={}, total={}",
                orderId, items.size(), order.getTotal());
        return orderRepository.save(order);
    }

    /**
     * 테이블의 최신 오픈 빌에 추가, 없으면 새로 생성
     *
     * @return 추가된 기존 빌 (없으면 empty)
     */
    @Transactional
    public Optional<Order> appendToLatest(String tableNumber, List<OrderItem> items) {
        Optional<Order> latest = orderRepository.findLatestOpenBillByTable(tableNumber);
        if (latest.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(append(latest.get().getOrderId(), items));
    }

    @Transactional
    public Order submit(Long orderId) {
        Order order = lock(orderId);
        order.submit();
        log.info("[OpenBillTransactionService] 오픈 빌 주방 전달 - orderId={}", orderId);
        return orderRepository.save(order);
    }

    @Transactional
    public Order pay(Long orderId, PaymentMethod paymentMethod) {
        Order order = lock(orderId);
        order.payOpenBill(paymentMethod);
        log.info("[OpenBillTransactionService] 오픈 빌 결제 - orderId={}, method={}, total={}",
                orderId, order.getPaymentMethod(), order.getTotal());
        return orderRepository.save(order);
    }

    private Order lock(Long orderId) {
        return orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }
}
