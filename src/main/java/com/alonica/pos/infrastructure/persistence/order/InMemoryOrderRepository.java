package com.alonica.pos.infrastructure.persistence.order;

import com.alonica.pos.domain.order.Order;
import com.alonica.pos.domain.order.OrderRepository;
import com.alonica.pos.domain.order.OrderStatus;
import com.alonica.pos.domain.order.PaymentStatus;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * InMemoryOrderRepository - Order 저장소 구현체 (인메모리)
 * ConcurrentHashMap을 사용하여 스레드 안전성 제공
 *
 * 결제 상태 compare-and-set은 ConcurrentHashMap.compute로 주문 단위 원자성을 보장한다.
 */
@Repository
public class InMemoryOrderRepository implements OrderRepository {

    private final ConcurrentHashMap<Long, Order> orders = new ConcurrentHashMap<>();
    private long orderIdSequence = 5000L;  // 초기 order_id 값

    @Override
    public Order save(Order order) {
        if (order.getOrderId() == null) {
            synchronized (this) {
                Long newOrderId = ++orderIdSequence;
                Order savedOrder = order.toBuilder().orderId(newOrderId).build();
                orders.put(newOrderId, savedOrder);
                return savedOrder;
            }
        }
        orders.put(order.getOrderId(), order);
        return order;
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public Optional<Order> findByIdForUpdate(Long orderId) {
        return findById(orderId);
    }

    @Override
    public Optional<Order> findByGatewayOrderId(String gatewayOrderId) {
        return orders.values().stream()
                .filter(order -> gatewayOrderId.equals(order.getGatewayOrderId()))
                .findFirst();
    }

    @Override
    public List<Order> findAll(OrderStatus status) {
        return orders.values().stream()
                .filter(order -> status == null || order.getOrderStatus() == status)
                .sorted(Comparator.comparing(Order::getCreatedAt).thenComparing(Order::getOrderId).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Order> findLatestOpenBillByTable(String tableNumber) {
        return findOpenBills().stream()
                .filter(order -> Objects.equals(order.getTableNumber(), tableNumber))
                .findFirst();
    }

    @Override
    public List<Order> findOpenBills() {
        return findAll(OrderStatus.QUEUED).stream()
                .filter(Order::isOpenBill)
                .collect(Collectors.toList());
    }

    @Override
    public List<Order> findPaidBetween(LocalDateTime from, LocalDateTime to) {
        return orders.values().stream()
                .filter(order -> order.getPaymentStatus() == PaymentStatus.PAID)
                .filter(order -> order.getPaidAt() != null)
                .filter(order -> !order.getPaidAt().isBefore(from) && !order.getPaidAt().isAfter(to))
                .sorted(Comparator.comparing(Order::getPaidAt))
                .collect(Collectors.toList());
    }

    @Override
    public boolean compareAndSetPaymentStatus(Long orderId, PaymentStatus expected, PaymentStatus next,
                                              String transactionStatus, LocalDateTime now) {
        AtomicBoolean applied = new AtomicBoolean(false);
        orders.computeIfPresent(orderId, (id, order) -> {
            if (order.getPaymentStatus() == expected) {
                order.applyGatewayPaymentStatus(next, transactionStatus, now);
                applied.set(true);
            }
            return order;
        });
        return applied.get();
    }

    /**
     * 테스트용: 모든 주문 삭제
     */
    public void clear() {
        orders.clear();
    }
}
