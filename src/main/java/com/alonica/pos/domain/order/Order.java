package com.alonica.pos.domain.order;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Order 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 주문 진행 상태(orderStatus)와 결제 상태(paymentStatus) 관리
 * - 주문 금액 계산: total = subtotal - discount
 * - 오픈 빌(payLater) 항목 추가/교체/삭제
 *
 * 핵심 비즈니스 규칙:
 * - 주문 상태는 QUEUED → PENDING → PREPARING → SERVED 방향으로만 변경 가능
 * - 모든 변경 후 total == subtotal - discount, 0 <= discount <= subtotal
 * - 생성 이후 주문 항목은 절대 비어 있을 수 없음
 * - 오픈 빌은 payOpenBill 전까지 PAID가 될 수 없음
 * - 주문은 삭제되지 않음
 */
@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_orders_table_open_bill", columnList = "table_number, pay_later, order_status"),
        @Index(name = "idx_orders_gateway_order_id", columnList = "gateway_order_id"),
        @Index(name = "idx_orders_paid_at", columnList = "paid_at")
})
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "customer_name", nullable = false)
    private String customerName;

    @Column(name = "table_number")
    private String tableNumber;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "order_items", joinColumns = @JoinColumn(name = "order_id"))
    @OrderColumn(name = "item_index")
    @Builder.Default
    private List<OrderItem> items = new ArrayList<>();

    @Column(name = "subtotal", nullable = false)
    private Long subtotal;

    @Column(name = "discount", nullable = false)
    private Long discount;

    @Column(name = "total", nullable = false)
    private Long total;

    @Column(name = "payment_method", nullable = false)
    @Enumerated(EnumType.STRING)
    private PaymentMethod paymentMethod;

    @Column(name = "payment_status", nullable = false)
    @Enumerated(EnumType.STRING)
    private PaymentStatus paymentStatus;

    @Column(name = "order_status", nullable = false)
    @Enumerated(EnumType.STRING)
    private OrderStatus orderStatus;

    @Column(name = "pay_later", nullable = false)
    private boolean payLater;

    @Column(name = "gateway_order_id")
    private String gatewayOrderId;

    @Column(name = "gateway_transaction_id")
    private String gatewayTransactionId;

    @Column(name = "gateway_transaction_status")
    private String gatewayTransactionStatus;

    @Column(name = "qris_url", length = 1024)
    private String qrisUrl;

    @Column(name = "qris_string", length = 2048)
    private String qrisString;

    @Column(name = "payment_expired_at")
    private LocalDateTime paymentExpiredAt;

    @Column(name = "mock_payment", nullable = false)
    private boolean mockPayment;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 현금 주문 생성 (즉시 결제 완료)
     *
     * 상태: orderStatus=PENDING, paymentStatus=PAID, paidAt=now
     */
    public static Order createCashOrder(String customerName, String tableNumber, List<OrderItem> items, long discount) {
        Order order = newOrder(customerName, tableNumber, items, discount, PaymentMethod.CASH);
        order.orderStatus = OrderStatus.PENDING;
        order.paymentStatus = PaymentStatus.PAID;
        order.paidAt = order.createdAt;
        return order;
    }

    /**
     * QRIS 주문 생성 (게이트웨이 결제 대기)
     *
     * 상태: orderStatus=PENDING, paymentStatus=PENDING
     * 게이트웨이 정보는 attachGatewayCharge로 이후에 기록
     */
    public static Order createQrisOrder(String customerName, String tableNumber, List<OrderItem> items, long discount) {
        Order order = newOrder(customerName, tableNumber, items, discount, PaymentMethod.QRIS);
        order.orderStatus = OrderStatus.PENDING;
        order.paymentStatus = PaymentStatus.PENDING;
        return order;
    }

    /**
     * 오픈 빌 생성 (나중에 결제)
     *
     * 상태: payLater=true, orderStatus=QUEUED, paymentStatus=UNPAID
     */
    public static Order createOpenBill(String customerName, String tableNumber, List<OrderItem> items,
                                       PaymentMethod paymentMethod) {
        Order order = newOrder(customerName, tableNumber, items, 0L,
                paymentMethod != null ? paymentMethod : PaymentMethod.CASH);
        order.payLater = true;
        order.orderStatus = OrderStatus.QUEUED;
        order.paymentStatus = PaymentStatus.UNPAID;
        return order;
    }

    private static Order newOrder(String customerName, String tableNumber, List<OrderItem> items,
                                  long discount, PaymentMethod paymentMethod) {
        if (customerName == null || customerName.isBlank()) {
            throw new IllegalArgumentException("고객 이름은 필수입니다");
        }
        if (discount < 0) {
            throw new IllegalArgumentException("할인 금액은 음수가 될 수 없습니다");
        }
        requireItems(items);

        LocalDateTime now = LocalDateTime.now();
        Order order = Order.builder()
                .customerName(customerName)
                .tableNumber(tableNumber)
                .items(new ArrayList<>(items))
                .discount(discount)
                .paymentMethod(paymentMethod)
                .createdAt(now)
                .updatedAt(now)
                .build();
        order.recalculateTotals();
        return order;
    }

    private static void requireItems(List<OrderItem> items) {
        if (items == null || items.isEmpty()) {
            throw new InvalidOrderItemsException("주문 항목이 최소 1개 이상 필요합니다");
        }
    }

    /**
     * 금액 재계산
     *
     * - subtotal = Σ 단가 × 수량
     * - discount는 subtotal을 넘지 않도록 보정
     * - total = subtotal - discount
     */
    private void recalculateTotals() {
        long sum = items.stream().mapToLong(OrderItem::getLineTotal).sum();
        long currentDiscount = discount == null ? 0L : discount;
        this.subtotal = sum;
        this.discount = Math.min(currentDiscount, sum);
        this.total = this.subtotal - this.discount;
    }

    public List<OrderItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    /**
     * 오픈 빌 여부: payLater이면서 아직 주방으로 전달되지 않았고 결제되지 않은 주문
     */
    public boolean isOpenBill() {
        return payLater && orderStatus == OrderStatus.QUEUED && paymentStatus != PaymentStatus.PAID;
    }

    public boolean isPaid() {
        return paymentStatus == PaymentStatus.PAID;
    }

    /**
     * 게이트웨이 결제 정보 기록 (QRIS 주문 생성 직후)
     */
    public void attachGatewayCharge(String gatewayOrderId, String gatewayTransactionId, String transactionStatus,
                                    String qrisUrl, String qrisString, LocalDateTime expiredAt, boolean mock) {
        this.gatewayOrderId = gatewayOrderId;
        this.gatewayTransactionId = gatewayTransactionId;
        this.gatewayTransactionStatus = transactionStatus;
        this.qrisUrl = qrisUrl;
        this.qrisString = qrisString;
        this.paymentExpiredAt = expiredAt;
        this.mockPayment = mock;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 주문 진행 상태 변경 (앞으로만 이동)
     *
     * @throws InvalidOrderStatusException 역방향 또는 같은 상태로의 변경
     */
    public void changeStatus(OrderStatus target) {
        if (!this.orderStatus.canTransitionTo(target)) {
            throw new InvalidOrderStatusException(this.orderId, this.orderStatus, target);
        }
        this.orderStatus = target;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 오픈 빌 주방 전달 (QUEUED → PENDING)
     */
    public void submit() {
        if (!isOpenBill()) {
            throw new OpenBillNotOpenException(this.orderId);
        }
        changeStatus(OrderStatus.PENDING);
    }

    /**
     * 오픈 빌 항목 추가 (QUEUED 상태에서만)
     */
    public void appendItems(List<OrderItem> newItems) {
        ensureOpenBill();
        requireItems(newItems);
        this.items.addAll(newItems);
        recalculateTotals();
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 오픈 빌 항목 전체 교체
     */
    public void replaceItems(List<OrderItem> newItems) {
        ensureOpenBill();
        requireItems(newItems);
        this.items.clear();
        this.items.addAll(newItems);
        recalculateTotals();
        this.updatedAt = LocalDateTime.now();
    }

    private void ensureOpenBill() {
        if (isPaid()) {
            throw new OrderAlreadyPaidException(this.orderId);
        }
        if (!isOpenBill()) {
            throw new OpenBillNotOpenException(this.orderId);
        }
    }

    /**
     * 오픈 빌 결제 (새 주문을 만들지 않고 기존 주문을 PAID로 전환)
     *
     * @param paymentMethod 결제 수단 (null이면 기존 값 유지)
     * @throws OrderAlreadyPaidException 이미 결제된 주문
     */
    public void payOpenBill(PaymentMethod paymentMethod) {
        if (isPaid()) {
            throw new OrderAlreadyPaidException(this.orderId);
        }
        if (!payLater) {
            throw new OpenBillNotOpenException(this.orderId);
        }
        if (paymentMethod != null) {
            this.paymentMethod = paymentMethod;
        }
        LocalDateTime now = LocalDateTime.now();
        this.paymentStatus = PaymentStatus.PAID;
        this.paidAt = now;
        this.updatedAt = now;
    }

    /**
     * 게이트웨이 결제 상태 반영
     *
     * - PAID로 전환될 때만 paidAt 기록 및 대기 상태(QUEUED/PENDING) 주문을 PREPARING으로 이동
     * - 호출자는 기존 결제 상태가 기대값과 같을 때만 호출해야 함 (compare-and-set)
     */
    public void applyGatewayPaymentStatus(PaymentStatus next, String transactionStatus, LocalDateTime now) {
        this.paymentStatus = next;
        this.gatewayTransactionStatus = transactionStatus;
        if (next == PaymentStatus.PAID) {
            this.paidAt = now;
            if (this.orderStatus.isWaiting()) {
                this.orderStatus = OrderStatus.PREPARING;
            }
        }
        this.updatedAt = now;
    }

    /**
     * 지정한 위치의 항목 삭제 (삭제 승인 시)
     *
     * @return 삭제된 항목
     */
    public OrderItem removeItemAt(int index) {
        if (index < 0 || index >= items.size()) {
            throw new IllegalArgumentException("유효하지 않은 항목 인덱스입니다: " + index);
        }
        if (items.size() == 1) {
            throw new InvalidOrderItemsException("마지막 남은 주문 항목은 삭제할 수 없습니다");
        }
        OrderItem removed = this.items.remove(index);
        recalculateTotals();
        this.updatedAt = LocalDateTime.now();
        return removed;
    }

    public int getItemCount() {
        return items.size();
    }
}
