package com.alonica.pos.infrastructure.persistence.order;

import com.alonica.pos.domain.order.Order;
import com.alonica.pos.domain.order.OrderStatus;
import com.alonica.pos.domain.order.PaymentStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Order JPA Repository
 * Spring Data JPA를 통한 Order 엔티티 영구 저장소
 */
public interface OrderJpaRepository extends JpaRepository<Order, Long> {

    /**
     * 비관적 락(Pessimistic Lock)으로 주문 조회
     * SELECT ... FOR UPDATE로 오픈 빌 수정/삭제 승인 간의 경쟁을 직렬화
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.orderId = :orderId")
    Optional<Order> findByIdForUpdate(@Param("orderId") Long orderId);

    Optional<Order> findFirstByGatewayOrderId(String gatewayOrderId);

    List<Order> findAllByOrderByCreatedAtDesc();

    List<Order> findByOrderStatusOrderByCreatedAtDesc(OrderStatus orderStatus);

    @Query("SELECT o FROM Order o " +
           "WHERE o.tableNumber = :tableNumber AND o.payLater = true " +
           "AND o.orderStatus = :queued AND o.paymentStatus <> :paid " +
           "ORDER BY o.createdAt DESC")
    List<Order> findOpenBillsByTable(@Param("tableNumber") String tableNumber,
                                     @Param("queued") OrderStatus queued,
                                     @Param("paid") PaymentStatus paid,
                                     Pageable pageable);

    @Query("SELECT o FROM Order o " +
           "WHERE o.payLater = true AND o.orderStatus = :queued AND o.paymentStatus <> :paid " +
           "ORDER BY o.createdAt DESC")
    List<Order> findOpenBills(@Param("queued") OrderStatus queued, @Param("paid") PaymentStatus paid);

    @Query("SELECT o FROM Order o " +
           "WHERE o.paymentStatus = :paid AND o.paidAt BETWEEN :fromTime AND :toTime " +
           "ORDER BY o.paidAt ASC")
    List<Order> findPaidBetween(@Param("paid") PaymentStatus paid,
                                @Param("fromTime") LocalDateTime from,
                                @Param("toTime") LocalDateTime to);

    /**
     * 결제 상태 compare-and-set (PAID 이외의 상태로 전환)
     *
     * @return 갱신된 행 수 (0이면 다른 요청이 먼저 상태를 바꿈)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.paymentStatus = :next, o.gatewayTransactionStatus = :transactionStatus, " +
           "o.updatedAt = :now " +
           "WHERE o.orderId = :orderId AND o.paymentStatus = :expected")
    int updatePaymentStatusIfMatches(@Param("orderId") Long orderId,
                                     @Param("expected") PaymentStatus expected,
                                     @Param("next") PaymentStatus next,
                                     @Param("transactionStatus") String transactionStatus,
                                     @Param("now") LocalDateTime now);

    /**
     * 결제 상태 compare-and-set (PAID로 전환, paidAt 기록)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.paymentStatus = :paid, o.gatewayTransactionStatus = :transactionStatus, " +
           "o.paidAt = :now, o.updatedAt = :now " +
           "WHERE o.orderId = :orderId AND o.paymentStatus = :expected")
    int markPaidIfMatches(@Param("orderId") Long orderId,
                          @Param("expected") PaymentStatus expected,
                          @Param("paid") PaymentStatus paid,
                          @Param("transactionStatus") String transactionStatus,
                          @Param("now") LocalDateTime now);

    /**
     * 대기 상태(QUEUED/PENDING) 주문을 PREPARING으로 이동
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.orderStatus = :preparing, o.updatedAt = :now " +
           "WHERE o.orderId = :orderId AND o.orderStatus IN :waiting")
    int advanceOrderStatus(@Param("orderId") Long orderId,
                           @Param("preparing") OrderStatus preparing,
                           @Param("waiting") Collection<OrderStatus> waiting,
                           @Param("now") LocalDateTime now);
}
