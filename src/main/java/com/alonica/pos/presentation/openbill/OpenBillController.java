package com.alonica.pos.presentation.openbill;

import com.alonica.pos.application.openbill.OpenBillService;
import com.alonica.pos.application.openbill.dto.OpenBillCommand;
import com.alonica.pos.application.openbill.dto.OpenBillResult;
import com.alonica.pos.domain.auth.Capability;
import com.alonica.pos.presentation.common.auth.RequiresCapability;
import com.alonica.pos.presentation.openbill.request.OpenBillItemsRequest;
import com.alonica.pos.presentation.openbill.request.OpenBillRequest;
import com.alonica.pos.presentation.openbill.request.PayOpenBillRequest;
import com.alonica.pos.presentation.openbill.response.OpenBillResponse;
import com.alonica.pos.presentation.order.mapper.OrderMapper;
import com.alonica.pos.presentation.order.response.OrderResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * OpenBillController - 오픈 빌(나중에 결제) API 엔드포인트
 *
 * 오픈 빌은 주문 리소스의 한 형태이므로 /orders 하위에 둔다.
 */
@RestController
@RequestMapping("/orders")
public class OpenBillController {

    private final OpenBillService openBillService;
    private final OrderMapper orderMapper;

    public OpenBillController(OpenBillService openBillService, OrderMapper orderMapper) {
        this.openBillService = openBillService;
        this.orderMapper = orderMapper;
    }

    /**
     * 오픈 빌 생성 (POST /api/orders/open-bill)
     */
    @PostMapping("/open-bill")
    @RequiresCapability(Capability.MANAGE_OPEN_BILL)
    public ResponseEntity<OpenBillResponse> create(@Valid @RequestBody OpenBillRequest request) {
        OpenBillResult result = openBillService.create(toCommand(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(result));
    }

    /**
     * 테이블 기준 스마트 오픈 빌 (POST /api/orders/open-bill/smart)
     * 같은 테이블의 미결제 오픈 빌이 있으면 항목을 추가하고, 없으면 새로 만든다.
     */
    @PostMapping("/open-bill/smart")
    @RequiresCapability(Capability.MANAGE_OPEN_BILL)
    public ResponseEntity<OpenBillResponse> smart(@Valid @RequestBody OpenBillRequest request) {
        OpenBillResult result = openBillService.smart(toCommand(request));
        HttpStatus status = result.isCreated() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(toResponse(result));
    }

    /**
     * 항목 추가 (POST /api/orders/{order_id}/items)
     */
    @PostMapping("/{order_id}/items")
    @RequiresCapability(Capability.MANAGE_OPEN_BILL)
    public ResponseEntity<OpenBillResponse> append(@PathVariable("order_id") Long orderId,
                                                   @Valid @RequestBody OpenBillItemsRequest request) {
        OpenBillResult result = openBillService.append(orderId, orderMapper.toLineCommands(request.getItems()));
        return ResponseEntity.ok(toResponse(result));
    }

    /**
     * 항목 전체 교체 (PUT /api/orders/{order_id}/items)
     */
    @PutMapping("/{order_id}/items")
    @RequiresCapability(Capability.MANAGE_OPEN_BILL)
    public ResponseEntity<OpenBillResponse> replace(@PathVariable("order_id") Long orderId,
                                                    @Valid @RequestBody OpenBillItemsRequest request) {
        OpenBillResult result = openBillService.replace(orderId, orderMapper.toLineCommands(request.getItems()));
        return ResponseEntity.ok(toResponse(result));
    }

    /**
     * 주방 전달 (PATCH /api/orders/{order_id}/submit)
     */
    @PatchMapping("/{order_id}/submit")
    @RequiresCapability(Capability.MANAGE_OPEN_BILL)
    public ResponseEntity<OpenBillResponse> submit(@PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(toResponse(openBillService.submit(orderId)));
    }

    /**
     * 오픈 빌 결제 (POST /api/orders/{order_id}/pay)
     * 본문은 선택이며 payment_method를 바꿀 때만 보낸다.
     */
    @PostMapping("/{order_id}/pay")
    @RequiresCapability(Capability.MANAGE_OPEN_BILL)
    public ResponseEntity<OpenBillResponse> pay(@PathVariable("order_id") Long orderId,
                                                @RequestBody(required = false) PayOpenBillRequest request) {
        String method = request != null ? request.getPaymentMethod() : null;
        return ResponseEntity.ok(toResponse(openBillService.pay(orderId, method)));
    }

    /**
     * 미결제 오픈 빌 목록 (GET /api/orders/open-bills)
     */
    @GetMapping("/open-bills")
    @RequiresCapability(Capability.MANAGE_OPEN_BILL)
    public ResponseEntity<List<OrderResponse>> listOpenBills() {
        return ResponseEntity.ok(orderMapper.toOrderResponses(openBillService.listOpenBills()));
    }

    private OpenBillCommand toCommand(OpenBillRequest request) {
        return OpenBillCommand.builder()
                .customerName(request.getCustomerName())
                .tableNumber(request.getTableNumber())
                .items(orderMapper.toLineCommands(request.getItems()))
                .paymentMethod(request.getPaymentMethod())
                .build();
    }

    private OpenBillResponse toResponse(OpenBillResult result) {
        return OpenBillResponse.builder()
                .order(orderMapper.toOrderResponse(result.getOrder()))
                .created(result.isCreated())
                .build();
    }
}
