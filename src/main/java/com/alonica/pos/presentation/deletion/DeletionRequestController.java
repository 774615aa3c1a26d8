package com.alonica.pos.presentation.deletion;

import com.alonica.pos.application.deletion.DeletionApprovalService;
import com.alonica.pos.application.deletion.dto.DeletionDecisionResult;
import com.alonica.pos.domain.auth.Actor;
import com.alonica.pos.domain.auth.Capability;
import com.alonica.pos.domain.deletion.DeletionRequestStatus;
import com.alonica.pos.presentation.common.auth.RequiresCapability;
import com.alonica.pos.presentation.deletion.request.DeletionRequestRequest;
import com.alonica.pos.presentation.deletion.request.RejectDeletionRequest;
import com.alonica.pos.presentation.deletion.response.DeletionDecisionResponse;
import com.alonica.pos.presentation.deletion.response.DeletionLogResponse;
import com.alonica.pos.presentation.deletion.response.DeletionRequestResponse;
import com.alonica.pos.presentation.order.mapper.OrderMapper;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * DeletionRequestController - 오픈 빌 항목 삭제 승인 API
 *
 * 캐셔가 요청하고 관리자가 승인/거절한다. 승인된 삭제는 감사 로그로 남는다.
 */
@RestController
public class DeletionRequestController {

    private final DeletionApprovalService deletionApprovalService;
    private final OrderMapper orderMapper;

    public DeletionRequestController(DeletionApprovalService deletionApprovalService, OrderMapper orderMapper) {
        this.deletionApprovalService = deletionApprovalService;
        this.orderMapper = orderMapper;
    }

    /**
     * 삭제 요청 (POST /api/deletion-requests)
     */
    @PostMapping("/deletion-requests")
    @RequiresCapability(Capability.REQUEST_DELETION)
    public ResponseEntity<DeletionRequestResponse> requestDeletion(Actor actor,
                                                                   @Valid @RequestBody DeletionRequestRequest request) {
        var result = deletionApprovalService.requestDeletion(request.getOrderId(), request.getItemIndex(),
                request.getReason(), actor.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(DeletionRequestResponse.from(result));
    }

    /**
     * 삭제 요청 목록 (GET /api/deletion-requests?status=PENDING)
     */
    @GetMapping("/deletion-requests")
    @RequiresCapability(Capability.AUTHORIZE_DELETION)
    public ResponseEntity<List<DeletionRequestResponse>> listRequests(
            @RequestParam(value = "status", required = false) String status) {
        DeletionRequestStatus filter = status != null ? DeletionRequestStatus.fromString(status) : null;
        return ResponseEntity.ok(deletionApprovalService.listRequests(filter).stream()
                .map(DeletionRequestResponse::from)
                .collect(Collectors.toList()));
    }

    @PostMapping("/deletion-requests/{request_id}/approve")
    @RequiresCapability(Capability.AUTHORIZE_DELETION)
    public ResponseEntity<DeletionDecisionResponse> approve(Actor actor,
                                                            @PathVariable("request_id") Long requestId) {
        return ResponseEntity.ok(toResponse(deletionApprovalService.approve(requestId, actor.getUserId())));
    }

    @PostMapping("/deletion-requests/{request_id}/reject")
    @RequiresCapability(Capability.AUTHORIZE_DELETION)
    public ResponseEntity<DeletionDecisionResponse> reject(Actor actor,
                                                           @PathVariable("request_id") Long requestId,
                                                           @RequestBody(required = false) RejectDeletionRequest request) {
        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(toResponse(deletionApprovalService.reject(requestId, actor.getUserId(), reason)));
    }

    /**
     * 삭제 감사 로그 (GET /api/deletion-logs)
     */
    @GetMapping("/deletion-logs")
    @RequiresCapability(Capability.AUTHORIZE_DELETION)
    public ResponseEntity<List<DeletionLogResponse>> listLogs() {
        return ResponseEntity.ok(deletionApprovalService.listLogs().stream()
                .map(DeletionLogResponse::from)
                .collect(Collectors.toList()));
    }

    private DeletionDecisionResponse toResponse(DeletionDecisionResult result) {
        return DeletionDecisionResponse.builder()
                .request(DeletionRequestResponse.from(result.getRequest()))
                .order(result.getOrder() != null ? orderMapper.toOrderResponse(result.getOrder()) : null)
                .log(result.getLog() != null ? DeletionLogResponse.from(result.getLog()) : null)
                .build();
    }
}
