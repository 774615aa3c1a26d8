package com.alonica.pos.application.openbill;

import com.alonica.pos.application.hook.PostCommitHookDispatcher;
import com.alonica.pos.application.openbill.dto.OpenBillCommand;
import com.alonica.pos.application.openbill.dto.OpenBillResult;
import com.alonica.pos.application.order.OrderPricingService;
import com.alonica.pos.application.order.dto.OrderLineCommand;
import com.alonica.pos.application.order.dto.OrderResult;
import com.alonica.pos.domain.order.Order;
import com.alonica.pos.domain.order.OrderItem;
import com.alonica.pos.domain.order.OrderRepository;
import com.alonica.pos.domain.order.PaymentMethod;
import com.alonica.pos.domain.order.event.OrderPaidEvent;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * OpenBillService - 테이블별 나중에 결제(오픈 빌) 관리
 *
 * - create: payLater=true, QUEUED, UNPAID 주문 생성
 * - append / replace: QUEUED 오픈 빌의 항목 추가 / 전체 교체
 * - smart: 테이블의 최신 오픈 빌이 있으면 추가, 없으면 생성
 * - submit: QUEUED → PENDING (주방 전달)
 * - pay: 새 주문을 만들지 않고 기존 오픈 빌을 PAID로 전환
 *
 * smart는 같은 테이블에 대한 동시 요청이 빌을 두 개 만들지 않도록 테이블 단위로 직렬화한다.
 */
@Service
public class OpenBillService {

    private final OrderRepository orderRepository;
    private final OrderPricingService orderPricingService;
    private final OpenBillTransactionService openBillTransactionService;
    private final PostCommitHookDispatcher hookDispatcher;
    private final ConcurrentHashMap<String, Object> tableLocks = new ConcurrentHashMap<>();

    public OpenBillService(OrderRepository orderRepository,
                           OrderPricingService orderPricingService,
                           OpenBillTransactionService openBillTransactionService,
                           PostCommitHookDispatcher hookDispatcher) {
        this.orderRepository = orderRepository;
        this.orderPricingService = orderPricingService;
        this.openBillTransactionService = openBillTransactionService;
        this.hookDispatcher = hookDispatcher;
    }

    public OpenBillResult create(OpenBillCommand command) {
        Order openBill = newOpenBill(command);
        return result(openBillTransactionService.create(openBill), true);
    }

    public OpenBillResult append(Long orderId, List<OrderLineCommand> lines) {
        List<OrderItem> items = orderPricingService.price(lines);
        return result(openBillTransactionService.append(orderId, items), false);
    }

    public OpenBillResult replace(Long orderId, List<OrderLineCommand> lines) {
        List<OrderItem> items = orderPricingService.price(lines);
        return result(openBillTransactionService.replace(orderId, items), false);
    }

    public OpenBillResult smart(OpenBillCommand command) {
        if (command.getTableNumber() == null || command.getTableNumber().isBlank()) {
            throw new IllegalArgumentException("테이블 번호는 필수입니다");
        }
        Order newBill = newOpenBill(command);
        Object lock = tableLocks.computeIfAbsent(command.getTableNumber(), key -> new Object());
        synchronized (lock) {
            Optional<Order> appended = openBillTransactionService.appendToLatest(
                    command.getTableNumber(), newBill.getItems());
            if (appended.isPresent()) {
                return result(appended.get(), false);
            }
            return result(openBillTransactionService.create(newBill), true);
        }
    }

    public OpenBillResult submit(Long orderId) {
        return result(openBillTransactionService.submit(orderId), false);
    }

    /**
     * 오픈 빌 결제
     *
     * @param paymentMethod null이면 기존 결제 수단 유지
     */
    public OpenBillResult pay(Long orderId, String paymentMethod) {
        PaymentMethod method = paymentMethod != null ? PaymentMethod.fromString(paymentMethod) : null;
        Order paid = openBillTransactionService.pay(orderId, method);
        hookDispatcher.dispatch(new OrderPaidEvent(paid.getOrderId(), paid.getPaymentMethod(),
                paid.getTotal(), paid.getPaidAt()));
        return result(paid, false);
    }

    public List<OrderResult> listOpenBills() {
        return orderRepository.findOpenBills().stream()
                .map(OrderResult::fromOrder)
                .collect(Collectors.toList());
    }

    private Order newOpenBill(OpenBillCommand command) {
        List<OrderItem> items = orderPricingService.price(command.getItems());
        PaymentMethod method = command.getPaymentMethod() != null
                ? PaymentMethod.fromString(command.getPaymentMethod())
                : PaymentMethod.CASH;
        return Order.createOpenBill(command.getCustomerName(), command.getTableNumber(), items, method);
    }

    private OpenBillResult result(Order order, boolean created) {
        return OpenBillResult.builder()
                .order(OrderResult.fromOrder(order))
                .created(created)
                .build();
    }
}
