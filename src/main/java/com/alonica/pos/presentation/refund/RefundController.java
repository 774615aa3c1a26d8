package com.alonica.pos.presentation.refund;

import com.alonica.pos.application.refund.RefundService;
import com.alonica.pos.domain.auth.Actor;
import com.alonica.pos.domain.auth.Capability;
import com.alonica.pos.presentation.common.auth.RequiresCapability;
import com.alonica.pos.presentation.refund.request.RejectRequest;
import com.alonica.pos.presentation.refund.request.RequestRefundRequest;
import com.alonica.pos.presentation.refund.response.RefundResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * RefundController - 환불 요청/승인 API
 *
 * 요청(캐셔) → 승인/거절(관리자) → 완료(현금 지급 후)
 */
@RestController
@RequestMapping("/refunds")
public class RefundController {

    private final RefundService refundService;

    public RefundController(RefundService refundService) {
        this.refundService = refundService;
    }

    @PostMapping
    @RequiresCapability(Capability.REQUEST_REFUND)
    public ResponseEntity<RefundResponse> requestRefund(Actor actor, @Valid @RequestBody RequestRefundRequest request) {
        var result = refundService.requestRefund(request.getOrderId(), request.getRefundAmount(),
                request.getRefundType(), request.getReason(), actor.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(RefundResponse.from(result));
    }

    /**
     * 주문별 환불 내역 (GET /api/refunds?order_id=)
     */
    @GetMapping
    @RequiresCapability(Capability.REQUEST_REFUND)
    public ResponseEntity<List<RefundResponse>> listRefunds(@RequestParam("order_id") Long orderId) {
        return ResponseEntity.ok(refundService.listRefunds(orderId).stream()
                .map(RefundResponse::from)
                .collect(Collectors.toList()));
    }

    @PostMapping("/{refund_id}/approve")
    @RequiresCapability(Capability.AUTHORIZE_REFUND)
    public ResponseEntity<RefundResponse> approve(Actor actor, @PathVariable("refund_id") Long refundId) {
        return ResponseEntity.ok(RefundResponse.from(refundService.approveRefund(refundId, actor.getUserId())));
    }

    @PostMapping("/{refund_id}/reject")
    @RequiresCapability(Capability.AUTHORIZE_REFUND)
    public ResponseEntity<RefundResponse> reject(Actor actor,
                                                 @PathVariable("refund_id") Long refundId,
                                                 @RequestBody(required = false) RejectRequest request) {
        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(RefundResponse.from(refundService.rejectRefund(refundId, actor.getUserId(), reason)));
    }

    /**
     * 환불 완료 (APPROVED 건만)
     */
    @PostMapping("/{refund_id}/complete")
    @RequiresCapability(Capability.REQUEST_REFUND)
    public ResponseEntity<RefundResponse> complete(@PathVariable("refund_id") Long refundId) {
        return ResponseEntity.ok(RefundResponse.from(refundService.completeRefund(refundId)));
    }
}
