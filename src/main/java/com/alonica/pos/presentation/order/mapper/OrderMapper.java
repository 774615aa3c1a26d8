package com.alonica.pos.presentation.order.mapper;

import com.alonica.pos.application.inventory.dto.StockDeductionResult;
import com.alonica.pos.application.inventory.dto.StockLine;
import com.alonica.pos.application.order.dto.CashOrderResult;
import com.alonica.pos.application.order.dto.CreateOrderCommand;
import com.alonica.pos.application.order.dto.OrderLineCommand;
import com.alonica.pos.application.order.dto.OrderResult;
import com.alonica.pos.application.order.dto.OrderStatusUpdateResult;
import com.alonica.pos.application.payment.dto.PaymentStatusResult;
import com.alonica.pos.presentation.order.request.CreateOrderRequest;
import com.alonica.pos.presentation.order.request.OrderItemRequest;
import com.alonica.pos.presentation.order.response.CashOrderResponse;
import com.alonica.pos.presentation.order.response.OrderItemResponse;
import com.alonica.pos.presentation.order.response.OrderResponse;
import com.alonica.pos.presentation.order.response.OrderStatusUpdateResponse;
import com.alonica.pos.presentation.order.response.PaymentStatusResponse;
import com.alonica.pos.presentation.order.response.StockValidationResponse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderMapper - Presentation layer와 Application layer 간의 DTO 변환
 *
 * 책임:
 * - Presentation Request DTO → Application Command 변환
 * - Application Result DTO → Presentation Response DTO 변환
 *
 * 오픈 빌/삭제 승인 응답도 주문 본문은 이 변환을 재사용한다.
 */
@Component
public class OrderMapper {

    public CreateOrderCommand toCreateOrderCommand(CreateOrderRequest request) {
        return CreateOrderCommand.builder()
                .customerName(request.getCustomerName())
                .tableNumber(request.getTableNumber())
                .items(toLineCommands(request.getItems()))
                .discount(request.getDiscount())
                .received(request.getReceived())
                .build();
    }

    public List<OrderLineCommand> toLineCommands(List<OrderItemRequest> items) {
        return items.stream()
                .map(item -> OrderLineCommand.builder()
                        .menuItemId(item.getMenuItemId())
                        .quantity(item.getQuantity())
                        .notes(item.getNotes())
                        .build())
                .collect(Collectors.toList());
    }

    public List<StockLine> toStockLines(List<OrderItemRequest> items) {
        return items.stream()
                .map(item -> new StockLine(item.getMenuItemId(), item.getQuantity()))
                .collect(Collectors.toList());
    }

    public OrderResponse toOrderResponse(OrderResult result) {
        return OrderResponse.builder()
                .orderId(result.getOrderId())
                .customerName(result.getCustomerName())
                .tableNumber(result.getTableNumber())
                .items(result.getItems().stream()
                        .map(item -> OrderItemResponse.builder()
                                .index(item.getIndex())
                                .menuItemId(item.getMenuItemId())
                                .name(item.getName())
                                .unitPrice(item.getUnitPrice())
                                .quantity(item.getQuantity())
                                .notes(item.getNotes())
                                .lineTotal(item.getLineTotal())
                                .build())
                        .collect(Collectors.toList()))
                .subtotal(result.getSubtotal())
                .discount(result.getDiscount())
                .total(result.getTotal())
                .paymentMethod(result.getPaymentMethod())
                .paymentStatus(result.getPaymentStatus())
                .orderStatus(result.getOrderStatus())
                .payLater(result.isPayLater())
                .gatewayOrderId(result.getGatewayOrderId())
                .gatewayTransactionStatus(result.getGatewayTransactionStatus())
                .qrisUrl(result.getQrisUrl())
                .qrisString(result.getQrisString())
                .paymentExpiredAt(result.getPaymentExpiredAt())
                .mockPayment(result.isMockPayment())
                .paidAt(result.getPaidAt())
                .createdAt(result.getCreatedAt())
                .updatedAt(result.getUpdatedAt())
                .build();
    }

    public List<OrderResponse> toOrderResponses(List<OrderResult> results) {
        return results.stream()
                .map(this::toOrderResponse)
                .collect(Collectors.toList());
    }

    public CashOrderResponse toCashOrderResponse(CashOrderResult result) {
        return CashOrderResponse.builder()
                .order(toOrderResponse(result.getOrder()))
                .received(result.getReceived())
                .change(result.getChange())
                .build();
    }

    public OrderStatusUpdateResponse toStatusUpdateResponse(OrderStatusUpdateResult result) {
        return OrderStatusUpdateResponse.builder()
                .order(toOrderResponse(result.getOrder()))
                .warnings(result.getWarnings())
                .build();
    }

    public PaymentStatusResponse toPaymentStatusResponse(PaymentStatusResult result) {
        return PaymentStatusResponse.builder()
                .orderId(result.getOrderId())
                .paymentStatus(result.getPaymentStatus())
                .orderStatus(result.getOrderStatus())
                .transactionStatus(result.getTransactionStatus())
                .total(result.getTotal())
                .paidAt(result.getPaidAt())
                .mockPayment(result.isMockPayment())
                .changed(result.isChanged())
                .build();
    }

    public StockValidationResponse toStockValidationResponse(StockDeductionResult result) {
        return StockValidationResponse.builder()
                .success(result.isSuccess())
                .insufficientStock(result.getInsufficientStock().stream()
                        .map(shortage -> StockValidationResponse.Shortage.builder()
                                .inventoryItemId(shortage.getInventoryItemId())
                                .name(shortage.getName())
                                .required(shortage.getRequired())
                                .available(shortage.getAvailable())
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }
}
