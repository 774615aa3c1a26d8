package com.alonica.pos.application.deletion;

import com.alonica.pos.application.deletion.dto.DeletionDecisionResult;
import com.alonica.pos.application.deletion.dto.DeletionLogResult;
import com.alonica.pos.application.deletion.dto.DeletionRequestResult;
import com.alonica.pos.application.order.dto.OrderResult;
import com.alonica.pos.domain.deletion.DeletionLogRepository;
import com.alonica.pos.domain.deletion.DeletionNotificationSink;
import com.alonica.pos.domain.deletion.DeletionRequest;
import com.alonica.pos.domain.deletion.DeletionRequestNotFoundException;
import com.alonica.pos.domain.deletion.DeletionRequestRepository;
import com.alonica.pos.domain.deletion.DeletionRequestStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * DeletionApprovalService - 오픈 빌 항목 삭제 2인 승인 절차
 *
 * 상태: PENDING → APPROVED | REJECTED
 * - 요청: 캐셔가 미결제 오픈 빌의 itemIndex(0부터) 항목 삭제를 사유와 함께 요청
 * - 승인: 관리자가 승인하면 항목 삭제, 금액 재계산, 감사 로그 기록
 * - 거절: 주문은 변경하지 않음
 *
 * 알림 전달 실패는 요청/결정 결과에 영향을 주지 않는다.
 * 승인/거절은 주문 단위 프로세스 내 잠금 안에서 실행되어 같은 요청이 두 번 반영되지 않는다.
 */
@Service
public class DeletionApprovalService {

    private static final Logger log = LoggerFactory.getLogger(DeletionApprovalService.class);

    private final DeletionTransactionService deletionTransactionService;
    private final DeletionRequestRepository deletionRequestRepository;
    private final DeletionLogRepository deletionLogRepository;
    private final DeletionNotificationSink notificationSink;
    private final ConcurrentHashMap<Long, Object> orderLocks = new ConcurrentHashMap<>();

    public DeletionApprovalService(DeletionTransactionService deletionTransactionService,
                                   DeletionRequestRepository deletionRequestRepository,
                                   DeletionLogRepository deletionLogRepository,
                                   DeletionNotificationSink notificationSink) {
        this.deletionTransactionService = deletionTransactionService;
        this.deletionRequestRepository = deletionRequestRepository;
        this.deletionLogRepository = deletionLogRepository;
        this.notificationSink = notificationSink;
    }

    public DeletionRequestResult requestDeletion(Long orderId, int itemIndex, String reason, Long requestedBy) {
        DeletionRequest request = deletionTransactionService.request(orderId, itemIndex, reason, requestedBy);
        notify(request, true);
        return DeletionRequestResult.from(request);
    }

    public DeletionDecisionResult approve(Long requestId, Long authorizerId) {
        DeletionTransactionService.ApprovedDeletion approved;
        synchronized (orderLock(requestId)) {
            approved = deletionTransactionService.approve(requestId, authorizerId);
        }
        notify(approved.getRequest(), false);
        return DeletionDecisionResult.builder()
                .request(DeletionRequestResult.from(approved.getRequest()))
                .order(OrderResult.fromOrder(approved.getOrder()))
                .log(DeletionLogResult.from(approved.getLog()))
                .build();
    }

    public DeletionDecisionResult reject(Long requestId, Long authorizerId, String rejectionReason) {
        DeletionRequest rejected;
        synchronized (orderLock(requestId)) {
            rejected = deletionTransactionService.reject(requestId, authorizerId, rejectionReason);
        }
        notify(rejected, false);
        return DeletionDecisionResult.builder()
                .request(DeletionRequestResult.from(rejected))
                .build();
    }

    /**
     * @param status null이면 전체
     */
    public List<DeletionRequestResult> listRequests(DeletionRequestStatus status) {
        return deletionRequestRepository.findByStatus(status).stream()
                .map(DeletionRequestResult::from)
                .collect(Collectors.toList());
    }

    public List<DeletionLogResult> listLogs() {
        return deletionLogRepository.findAll().stream()
                .map(DeletionLogResult::from)
                .collect(Collectors.toList());
    }

    private Object orderLock(Long requestId) {
        Long orderId = deletionRequestRepository.findById(requestId)
                .map(DeletionRequest::getOrderId)
                .orElseThrow(() -> new DeletionRequestNotFoundException(requestId));
        return orderLocks.computeIfAbsent(orderId, key -> new Object());
    }

    private void notify(DeletionRequest request, boolean requested) {
        try {
            if (requested) {
                notificationSink.deletionRequested(request);
            } else {
                notificationSink.deletionDecided(request);
            }
        } catch (RuntimeException e) {
            log.warn("[DeletionApprovalService] 삭제 알림 전달 실패 - requestId={}, error={}",
                    request.getRequestId(), e.getMessage());
        }
    }
}
