package com.alonica.pos.presentation.order;

import com.alonica.pos.application.inventory.StockDeductionService;
import com.alonica.pos.application.order.OrderService;
import com.alonica.pos.application.payment.PaymentReconciliationService;
import com.alonica.pos.domain.auth.Capability;
import com.alonica.pos.domain.order.OrderStatus;
import com.alonica.pos.presentation.common.auth.RequiresCapability;
import com.alonica.pos.presentation.order.mapper.OrderMapper;
import com.alonica.pos.presentation.order.request.CreateOrderRequest;
import com.alonica.pos.presentation.order.request.UpdateOrderStatusRequest;
import com.alonica.pos.presentation.order.request.ValidateStockRequest;
import com.alonica.pos.presentation.order.response.CashOrderResponse;
import com.alonica.pos.presentation.order.response.OrderResponse;
import com.alonica.pos.presentation.order.response.OrderStatusUpdateResponse;
import com.alonica.pos.presentation.order.response.PaymentStatusResponse;
import com.alonica.pos.presentation.order.response.StockValidationResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * OrderController - 주문 API 엔드포인트
 *
 * 공개 엔드포인트 (고객 셀프 주문): QRIS 주문 생성, 재고 사전 검증, 결제 상태 조회
 * 나머지는 X-USER-ID / X-USER-ROLE 헤더와 권한이 필요하다.
 */
@RestController
@RequestMapping("/orders")
public class OrderController {

    private final OrderService orderService;
    private final PaymentReconciliationService paymentReconciliationService;
    private final StockDeductionService stockDeductionService;
    private final OrderMapper orderMapper;

    public OrderController(OrderService orderService,
                           PaymentReconciliationService paymentReconciliationService,
                           StockDeductionService stockDeductionService,
                           OrderMapper orderMapper) {
        this.orderService = orderService;
        this.paymentReconciliationService = paymentReconciliationService;
        this.stockDeductionService = stockDeductionService;
        this.orderMapper = orderMapper;
    }

    /**
     * QRIS 주문 생성 (POST /api/orders)
     * 게이트웨이가 실패해도 모의 결제로 201을 반환한다.
     */
    @PostMapping
    public ResponseEntity<OrderResponse> createQrisOrder(@Valid @RequestBody CreateOrderRequest request) {
        var result = orderService.createQrisOrder(orderMapper.toCreateOrderCommand(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(orderMapper.toOrderResponse(result));
    }

    /**
     * 현금 주문 생성 (POST /api/orders/cash)
     */
    @PostMapping("/cash")
    @RequiresCapability(Capability.CREATE_ORDER)
    public ResponseEntity<CashOrderResponse> createCashOrder(@Valid @RequestBody CreateOrderRequest request) {
        var result = orderService.createCashOrder(orderMapper.toCreateOrderCommand(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(orderMapper.toCashOrderResponse(result));
    }

    /**
     * 주문 상세 조회 (GET /api/orders/{order_id})
     */
    @GetMapping("/{order_id}")
    @RequiresCapability(Capability.VIEW_ORDERS)
    public ResponseEntity<OrderResponse> getOrder(@PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(orderMapper.toOrderResponse(orderService.getOrder(orderId)));
    }

    /**
     * 주문 목록 조회 (GET /api/orders?status=)
     */
    @GetMapping
    @RequiresCapability(Capability.VIEW_ORDERS)
    public ResponseEntity<List<OrderResponse>> listOrders(
            @RequestParam(value = "status", required = false) String status) {
        OrderStatus filter = status != null ? OrderStatus.fromString(status) : null;
        return ResponseEntity.ok(orderMapper.toOrderResponses(orderService.listOrders(filter)));
    }

    /**
     * 주문 상태 변경 (PATCH /api/orders/{order_id}/status)
     * SERVED 전환 시 재고 차감 실패는 warnings로 전달된다.
     */
    @PatchMapping("/{order_id}/status")
    @RequiresCapability(Capability.UPDATE_ORDER_STATUS)
    public ResponseEntity<OrderStatusUpdateResponse> updateOrderStatus(
            @PathVariable("order_id") Long orderId,
            @Valid @RequestBody UpdateOrderStatusRequest request) {
        var result = orderService.updateOrderStatus(orderId, OrderStatus.fromString(request.getStatus()));
        return ResponseEntity.ok(orderMapper.toStatusUpdateResponse(result));
    }

    /**
     * 재고 사전 검증 (POST /api/orders/validate-stock)
     */
    @PostMapping("/validate-stock")
    public ResponseEntity<StockValidationResponse> validateStock(@Valid @RequestBody ValidateStockRequest request) {
        var result = stockDeductionService.validate(orderMapper.toStockLines(request.getItems()));
        return ResponseEntity.ok(orderMapper.toStockValidationResponse(result));
    }

    /**
     * 결제 상태 확인 (GET /api/orders/{order_id}/payment-status)
     * 대기 중인 QRIS 주문이면 게이트웨이를 조회해 반영한다.
     */
    @GetMapping("/{order_id}/payment-status")
    public ResponseEntity<PaymentStatusResponse> checkPaymentStatus(@PathVariable("order_id") Long orderId) {
        var result = paymentReconciliationService.checkPaymentStatus(orderId);
        return ResponseEntity.ok(orderMapper.toPaymentStatusResponse(result));
    }
}
