package com.alonica.pos.application.order;

import com.alonica.pos.application.hook.PostCommitHookDispatcher;
import com.alonica.pos.application.order.dto.CashOrderResult;
import com.alonica.pos.application.order.dto.CreateOrderCommand;
import com.alonica.pos.application.order.dto.OrderResult;
import com.alonica.pos.application.order.dto.OrderStatusUpdateResult;
import com.alonica.pos.common.exception.DomainException;
import com.alonica.pos.common.exception.ErrorCode;
import com.alonica.pos.domain.order.Order;
import com.alonica.pos.domain.order.OrderItem;
import com.alonica.pos.domain.order.OrderNotFoundException;
import com.alonica.pos.domain.order.OrderRepository;
import com.alonica.pos.domain.order.OrderStatus;
import com.alonica.pos.domain.order.event.OrderPaidEvent;
import com.alonica.pos.domain.order.event.OrderServedEvent;
import com.alonica.pos.domain.payment.PaymentGateway;
import com.alonica.pos.domain.payment.QrisCharge;
import com.alonica.pos.domain.payment.QrisChargeRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

/**
 * OrderService - 주문 생성/상태 변경 흐름 조정자 (Application 계층)
 *
 * 플로우 (주문 생성):
 * OrderController
 *     ↓
 * OrderService.createCashOrder() / createQrisOrder()
 *     ├─ 1단계: 메뉴 가격 책정, 결제 게이트웨이 호출 (트랜잭션 없음)
 *     ├─ 2단계: 주문 저장 (OrderTransactionService 위임)
 *     └─ 3단계: 커밋 이후 훅 (매출 재집계)
 *
 * 플로우 (상태 변경):
 *     ├─ 2단계: 잠금 후 전진 전환 (OrderTransactionService 위임)
 *     └─ 3단계: SERVED 전환 시 재고 차감 훅, 실패는 경고로만 반환
 *
 * QRIS 결제 게이트웨이가 비활성이거나 실패하면 모의 결제로 대체하며 주문 생성은 실패하지 않는다.
 */
@Service
public class OrderService {

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);

    private static final String GATEWAY_ORDER_PREFIX = "ALONICA-";
    private static final String SUFFIX_CHARACTERS = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int SUFFIX_LENGTH = 5;

    private final OrderRepository orderRepository;
    private final OrderPricingService orderPricingService;
    private final OrderTransactionService orderTransactionService;
    private final PaymentGateway paymentGateway;
    private final PostCommitHookDispatcher hookDispatcher;
    private final int expiryMinutes;

    public OrderService(OrderRepository orderRepository,
                        OrderPricingService orderPricingService,
                        OrderTransactionService orderTransactionService,
                        PaymentGateway paymentGateway,
                        PostCommitHookDispatcher hookDispatcher,
                        @Value("${pos.payment.midtrans.expiry-minutes:15}") int expiryMinutes) {
        this.orderRepository = orderRepository;
        this.orderPricingService = orderPricingService;
        this.orderTransactionService = orderTransactionService;
        this.paymentGateway = paymentGateway;
        this.hookDispatcher = hookDispatcher;
        this.expiryMinutes = expiryMinutes;
    }

    /**
     * 현금 주문 생성 (즉시 결제 완료)
     *
     * @throws DomainException 받은 금액이 합계보다 적은 경우 (INSUFFICIENT_CASH_RECEIVED)
     */
    public CashOrderResult createCashOrder(CreateOrderCommand command) {
        // 1단계: 가격 책정과 검증
        List<OrderItem> items = orderPricingService.price(command.getItems());
        Order order = Order.createCashOrder(command.getCustomerName(), command.getTableNumber(), items,
                discountOf(command));

        long received = command.getReceived() != null ? command.getReceived() : order.getTotal();
        if (received < order.getTotal()) {
            throw new DomainException(ErrorCode.INSUFFICIENT_CASH_RECEIVED,
                    "total=" + order.getTotal() + ", received=" + received);
        }

        // 2단계: 저장
        Order saved = orderTransactionService.saveNewOrder(order);

        // 3단계: 커밋 이후 훅
        hookDispatcher.dispatch(new OrderPaidEvent(saved.getOrderId(), saved.getPaymentMethod(),
                saved.getTotal(), saved.getPaidAt()));

        return CashOrderResult.builder()
                .order(OrderResult.fromOrder(saved))
                .received(received)
                .change(received - saved.getTotal())
                .build();
    }

    /**
     * QRIS 주문 생성 (게이트웨이 결제 대기)
     */
    public OrderResult createQrisOrder(CreateOrderCommand command) {
        // 1단계: 가격 책정, 게이트웨이 결제 생성 (트랜잭션 밖에서 외부 호출)
        List<OrderItem> items = orderPricingService.price(command.getItems());
        Order order = Order.createQrisOrder(command.getCustomerName(), command.getTableNumber(), items,
                discountOf(command));

        QrisCharge charge = requestCharge(order);
        order.attachGatewayCharge(charge.getGatewayOrderId(), charge.getTransactionId(),
                charge.getTransactionStatus(), charge.getQrisUrl(), charge.getQrisString(),
                charge.getExpiredAt(), charge.isMock());

        // 2단계: 저장
        Order saved = orderTransactionService.saveNewOrder(order);
        return OrderResult.fromOrder(saved);
    }

    /**
     * 게이트웨이 결제 생성, 실패 시 모의 결제로 대체
     */
    private QrisCharge requestCharge(Order order) {
        if (!paymentGateway.isEnabled()) {
            log.warn("[OrderService] 결제 게이트웨이 비활성 - 모의 QRIS 결제로 대체");
            return QrisCharge.mock(LocalDateTime.now(), expiryMinutes);
        }

        String gatewayOrderId = generateGatewayOrderId();
        QrisChargeRequest request = QrisChargeRequest.builder()
                .gatewayOrderId(gatewayOrderId)
                .grossAmount(order.getTotal())
                .customerName(order.getCustomerName())
                .expiryMinutes(expiryMinutes)
                .lines(order.getItems().stream()
                        .map(item -> QrisChargeRequest.Line.builder()
                                .id(String.valueOf(item.getMenuItemId()))
                                .name(item.getName())
                                .price(item.getUnitPrice())
                                .quantity(item.getQuantity())
                                .build())
                        .collect(Collectors.toList()))
                .build();
        try {
            return paymentGateway.createQrisCharge(request);
        } catch (RuntimeException e) {
            log.warn("[OrderService] QRIS 결제 생성 실패 - 모의 결제로 대체, gatewayOrderId={}, error={}",
                    gatewayOrderId, e.getMessage());
            return QrisCharge.mock(LocalDateTime.now(), expiryMinutes);
        }
    }

    /**
     * 게이트웨이 주문 ID: ALONICA-{epochMillis}-{대문자/숫자 5자리}
     */
    static String generateGatewayOrderId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(SUFFIX_CHARACTERS.charAt(random.nextInt(SUFFIX_CHARACTERS.length())));
        }
        return GATEWAY_ORDER_PREFIX + System.currentTimeMillis() + "-" + suffix;
    }

    /**
     * 주문 상태 변경
     *
     * SERVED 전환이 커밋되면 재고 차감 훅을 실행한다.
     * 재고 차감 실패는 상태 변경을 되돌리지 않고 warnings로 반환된다.
     */
    public OrderStatusUpdateResult updateOrderStatus(Long orderId, OrderStatus target) {
        Order updated = orderTransactionService.changeStatus(orderId, target);

        List<String> warnings = List.of();
        if (target == OrderStatus.SERVED) {
            warnings = hookDispatcher.dispatch(new OrderServedEvent(updated.getOrderId(), updated.getItems()));
        }

        return OrderStatusUpdateResult.builder()
                .order(OrderResult.fromOrder(updated))
                .warnings(warnings)
                .build();
    }

    public OrderResult getOrder(Long orderId) {
        return orderRepository.findById(orderId)
                .map(OrderResult::fromOrder)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    /**
     * 주문 목록 (최신순), status가 있으면 필터링
     */
    public List<OrderResult> listOrders(OrderStatus status) {
        return orderRepository.findAll(status).stream()
                .map(OrderResult::fromOrder)
                .collect(Collectors.toList());
    }

    private long discountOf(CreateOrderCommand command) {
        return command.getDiscount() != null ? command.getDiscount() : 0L;
    }
}
