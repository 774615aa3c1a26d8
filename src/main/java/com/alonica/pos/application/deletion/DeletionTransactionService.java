package com.alonica.pos.application.deletion;

import com.alonica.pos.common.exception.SystemException;
import com.alonica.pos.common.exception.ErrorCode;
import com.alonica.pos.domain.deletion.DeletionLog;
import com.alonica.pos.domain.deletion.DeletionLogRepository;
import com.alonica.pos.domain.deletion.DeletionRequest;
import com.alonica.pos.domain.deletion.DeletionRequestNotFoundException;
import com.alonica.pos.domain.deletion.DeletionRequestRepository;
import com.alonica.pos.domain.order.Order;
import com.alonica.pos.domain.order.OrderItem;
import com.alonica.pos.domain.order.OrderNotFoundException;
import com.alonica.pos.domain.order.OrderRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * DeletionTransactionService - 삭제 요청 생성/승인/거절 트랜잭션
 *
 * 승인 처리 (한 트랜잭션):
 * 1. 요청 행 잠금 후 PENDING 확인 (주문 변경 전에 확인)
 * 2. 주문 행 잠금
 * 3. 요청 시점 스냅샷과 현재 항목 재비교 (인덱스 범위, 메뉴 ID, 수량)
 * 4. 항목 삭제 후 금액 재계산
 * 5. 삭제 전/후 항목을 JSON으로 담은 감사 로그 기록
 */
@Service
public class DeletionTransactionService {

    private static final Logger log = LoggerFactory.getLogger(DeletionTransactionService.class);

    private final DeletionRequestRepository deletionRequestRepository;
    private final DeletionLogRepository deletionLogRepository;
    private final OrderRepository orderRepository;
    private final ObjectMapper objectMapper;

    public DeletionTransactionService(DeletionRequestRepository deletionRequestRepository,
                                      DeletionLogRepository deletionLogRepository,
                                      OrderRepository orderRepository,
                                      ObjectMapper objectMapper) {
        this.deletionRequestRepository = deletionRequestRepository;
        this.deletionLogRepository = deletionLogRepository;
        this.orderRepository = orderRepository;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public DeletionRequest request(Long orderId, int itemIndex, String reason, Long requestedBy) {
        Order order = lockOrder(orderId);
        DeletionRequest saved = deletionRequestRepository.save(
                DeletionRequest.request(order, itemIndex, reason, requestedBy));
        log.info("[DeletionTransactionService] 삭제 요청 생성 - requestId={}, orderId={}, itemIndex={}",
                saved.getRequestId(), orderId, itemIndex);
        return saved;
    }

    @Transactional
    public ApprovedDeletion approve(Long requestId, Long authorizerId) {
        DeletionRequest request = lockRequest(requestId);
        request.ensurePending();
        Order order = lockOrder(request.getOrderId());
        request.verifyStillApplicable(order);

        List<OrderItem> itemsBefore = List.copyOf(order.getItems());
        long totalBefore = order.getTotal();
        OrderItem removed = order.removeItemAt(request.getItemIndex());
        Order savedOrder = orderRepository.save(order);

        request.approve(authorizerId);
        DeletionRequest savedRequest = deletionRequestRepository.save(request);

        DeletionLog deletionLog = deletionLogRepository.save(DeletionLog.builder()
                .orderId(savedOrder.getOrderId())
                .requestId(requestId)
                .itemIndex(request.getItemIndex())
                .deletedItemName(removed.getName())
                .deletedItemQuantity(removed.getQuantity())
                .deletedItemAmount(removed.getLineTotal())
                .itemsBefore(toJson(itemsBefore))
                .itemsAfter(toJson(savedOrder.getItems()))
                .totalBefore(totalBefore)
                .totalAfter(savedOrder.getTotal())
                .reason(request.getReason())
                .requestedBy(request.getRequestedBy())
                .authorizedBy(authorizerId)
                .createdAt(LocalDateTime.now())
                .build());

        log.info("[DeletionTransactionService] 삭제 승인 - requestId={}, orderId={}, item={}, total {} → {}",
                requestId, savedOrder.getOrderId(), removed.getName(), totalBefore, savedOrder.getTotal());
        return new ApprovedDeletion(savedRequest, savedOrder, deletionLog);
    }

    @Transactional
    public DeletionRequest reject(Long requestId, Long authorizerId, String rejectionReason) {
        DeletionRequest request = lockRequest(requestId);
        request.reject(authorizerId, rejectionReason);
        log.info("[DeletionTransactionService] 삭제 거절 - requestId={}, authorizedBy={}", requestId, authorizerId);
        return deletionRequestRepository.save(request);
    }

    private DeletionRequest lockRequest(Long requestId) {
        return deletionRequestRepository.findByIdForUpdate(requestId)
                .orElseThrow(() -> new DeletionRequestNotFoundException(requestId));
    }

    private Order lockOrder(Long orderId) {
        return orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    private String toJson(List<OrderItem> items) {
        try {
            return objectMapper.writeValueAsString(items);
        } catch (JsonProcessingException e) {
            throw new SystemException(ErrorCode.INTERNAL_SERVER_ERROR, "삭제 로그 직렬화 실패", e);
        }
    }

    /**
     * 승인 결과 (요청, 변경된 주문, 감사 로그)
     */
    public static class ApprovedDeletion {
        private final DeletionRequest request;
        private final Order order;
        private final DeletionLog log;

        public ApprovedDeletion(DeletionRequest request, Order order, DeletionLog log) {
            this.request = request;
            this.order = order;
            this.log = log;
        }

        public DeletionRequest getRequest() {
            return request;
        }

        public Order getOrder() {
            return order;
        }

        public DeletionLog getLog() {
            return log;
        }
    }
}
