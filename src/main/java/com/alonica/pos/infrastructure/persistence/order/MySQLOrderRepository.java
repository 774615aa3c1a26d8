package com.alonica.pos.infrastructure.persistence.order;

import com.alonica.pos.domain.order.Order;
import com.alonica.pos.domain.order.OrderRepository;
import com.alonica.pos.domain.order.OrderStatus;
import com.alonica.pos.domain.order.PaymentStatus;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Order Repository 구현
 * Spring Data JPA를 사용한 영구 저장소
 *
 * Port(OrderRepository) 인터페이스를 구현하면서 JpaRepository 기능 제공
 */
@Repository
public class MySQLOrderRepository implements OrderRepository {

    private final OrderJpaRepository orderJpaRepository;

    public MySQLOrderRepository(OrderJpaRepository orderJpaRepository) {
        this.orderJpaRepository = orderJpaRepository;
    }

    @Override
    public Order save(Order order) {
        return orderJpaRepository.save(order);
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return orderJpaRepository.findById(orderId);
    }

    @Override
    @Transactional
    public Optional<Order> findByIdForUpdate(Long orderId) {
        // ✅ 비관적 락: 호출자의 트랜잭션이 끝날 때까지 행 잠금 유지
        return orderJpaRepository.findByIdForUpdate(orderId);
    }

    @Override
    public Optional<Order> findByGatewayOrderId(String gatewayOrderId) {
        return orderJpaRepository.findFirstByGatewayOrderId(gatewayOrderId);
    }

    @Override
    public List<Order> findAll(OrderStatus status) {
        if (status == null) {
            return orderJpaRepository.findAllByOrderByCreatedAtDesc();
        }
        return orderJpaRepository.findByOrderStatusOrderByCreatedAtDesc(status);
    }

    @Override
    public Optional<Order> findLatestOpenBillByTable(String tableNumber) {
        return orderJpaRepository.findOpenBillsByTable(tableNumber, OrderStatus.QUEUED, PaymentStatus.PAID,
                        PageRequest.of(0, 1))
                .stream()
                .findFirst();
    }

    @Override
    public List<Order> findOpenBills() {
        return orderJpaRepository.findOpenBills(OrderStatus.QUEUED, PaymentStatus.PAID);
    }

    @Override
    public List<Order> findPaidBetween(LocalDateTime from, LocalDateTime to) {
        return orderJpaRepository.findPaidBetween(PaymentStatus.PAID, from, to);
    }

    @Override
    @Transactional
    public boolean compareAndSetPaymentStatus(Long orderId, PaymentStatus expected, PaymentStatus next,
                                              String transactionStatus, LocalDateTime now) {
        if (next != PaymentStatus.PAID) {
            return orderJpaRepository.updatePaymentStatusIfMatches(orderId, expected, next, transactionStatus, now) == 1;
        }
        int updated = orderJpaRepository.markPaidIfMatches(orderId, expected, PaymentStatus.PAID, transactionStatus, now);
        if (updated == 0) {
            return false;
        }
        // CAS 승자만 주문 상태를 조리 단계로 이동 (같은 트랜잭션)
        orderJpaRepository.advanceOrderStatus(orderId, OrderStatus.PREPARING,
                EnumSet.of(OrderStatus.QUEUED, OrderStatus.PENDING), now);
        return true;
    }
}
