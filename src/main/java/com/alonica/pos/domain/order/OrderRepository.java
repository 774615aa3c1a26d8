package com.alonica.pos.domain.order;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * OrderRepository - Order 도메인 영속성 Port Interface
 * 구현체: MySQLOrderRepository (JPA), InMemoryOrderRepository (DB 미사용 시 대체)
 */
public interface OrderRepository {

    Order save(Order order);

    Optional<Order> findById(Long orderId);

    /**
     * 비관적 락으로 주문 조회 (오픈 빌 수정, 삭제 승인 등 쓰기 작업용)
     */
    Optional<Order> findByIdForUpdate(Long orderId);

    Optional<Order> findByGatewayOrderId(String gatewayOrderId);

    /**
     * 전체 주문 (최신순), status가 있으면 주문 상태로 필터링
     */
    List<Order> findAll(OrderStatus status);

    /**
     * 테이블의 가장 최근 오픈 빌 (payLater, QUEUED, 미결제)
     */
    Optional<Order> findLatestOpenBillByTable(String tableNumber);

    /**
     * 미결제 오픈 빌 목록 (최신순)
     */
    List<Order> findOpenBills();

    /**
     * paidAt이 [from, to] 구간에 있는 결제 완료 주문
     */
    List<Order> findPaidBetween(LocalDateTime from, LocalDateTime to);

    /**
     * 결제 상태 compare-and-set
     *
     * 저장된 결제 상태가 expected와 같을 때만 next로 변경한다.
     * next가 PAID이면 paidAt을 기록하고 QUEUED/PENDING 주문을 PREPARING으로 이동한다.
     *
     * @return true: 이 호출이 상태를 변경함, false: 다른 호출이 먼저 변경함
     */
    boolean compareAndSetPaymentStatus(Long orderId, PaymentStatus expected, PaymentStatus next,
                                       String transactionStatus, LocalDateTime now);
}
