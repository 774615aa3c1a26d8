package com.alonica.pos.application.payment;

import com.alonica.pos.application.payment.dto.PaymentStatusResult;
import com.alonica.pos.application.payment.dto.WebhookNotification;
import com.alonica.pos.application.payment.dto.WebhookResult;
import com.alonica.pos.common.exception.ApplicationException;
import com.alonica.pos.common.exception.BizException;
import com.alonica.pos.common.exception.ErrorCode;
import com.alonica.pos.domain.order.Order;
import com.alonica.pos.domain.order.OrderNotFoundException;
import com.alonica.pos.domain.order.OrderRepository;
import com.alonica.pos.domain.payment.PaymentGateway;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * MidtransWebhookService - 결제 게이트웨이 웹훅 처리
 *
 * 응답 규칙:
 * - 본문 파싱 실패, 필수 필드 누락, 서명 불일치: 200으로 수신 확인만 하고 반영하지 않음 (재전송 방지)
 * - 주문을 찾을 수 없음: 404
 * - 반영 중 일시적 오류: 500 (게이트웨이가 재전송)
 */
@Slf4j
@Service
public class MidtransWebhookService {

    private final ObjectMapper objectMapper;
    private final PaymentGateway paymentGateway;
    private final OrderRepository orderRepository;
    private final PaymentReconciliationService reconciliationService;

    public MidtransWebhookService(ObjectMapper objectMapper,
                                  PaymentGateway paymentGateway,
                                  OrderRepository orderRepository,
                                  PaymentReconciliationService reconciliationService) {
        this.objectMapper = objectMapper;
        this.paymentGateway = paymentGateway;
        this.orderRepository = orderRepository;
        this.reconciliationService = reconciliationService;
    }

    public WebhookResult handle(String rawBody) {
        WebhookNotification notification;
        try {
            notification = objectMapper.readValue(rawBody, WebhookNotification.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("[MidtransWebhookService] 웹훅 본문 파싱 실패 - 수신 확인만 응답, error={}", e.getMessage());
            return WebhookResult.ignored("unparsable payload");
        }
        if (notification == null || !notification.hasRequiredFields()) {
            log.warn("[MidtransWebhookService] 웹훅 필수 필드 누락 - 수신 확인만 응답");
            return WebhookResult.ignored("missing fields");
        }

        if (!paymentGateway.verifySignature(notification.getOrderId(), notification.getStatusCode(),
                notification.getGrossAmount(), notification.getSignatureKey())) {
            log.warn("[MidtransWebhookService] 웹훅 서명 불일치 - 반영하지 않음, gatewayOrderId={}",
                    notification.getOrderId());
            return WebhookResult.ignored("invalid signature");
        }

        Order order = orderRepository.findByGatewayOrderId(notification.getOrderId())
                .orElseThrow(() -> {
                    log.warn("[MidtransWebhookService] 알 수 없는 주문의 웹훅 - gatewayOrderId={}",
                            notification.getOrderId());
                    return new OrderNotFoundException(notification.getOrderId());
                });

        try {
            PaymentStatusResult result = reconciliationService.merge(order, notification.getTransactionStatus());
            log.info("[MidtransWebhookService] 웹훅 반영 - orderId={}, transactionStatus={}, paymentStatus={}, changed={}",
                    order.getOrderId(), notification.getTransactionStatus(), result.getPaymentStatus(),
                    result.isChanged());
            return WebhookResult.applied(result.getPaymentStatus());
        } catch (BizException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[MidtransWebhookService] 웹훅 처리 실패 - gatewayOrderId={}", notification.getOrderId(), e);
            throw new ApplicationException(ErrorCode.WEBHOOK_PROCESSING_FAILED,
                    "gatewayOrderId=" + notification.getOrderId(), e);
        }
    }
}
