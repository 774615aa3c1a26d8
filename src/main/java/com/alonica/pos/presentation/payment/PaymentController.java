package com.alonica.pos.presentation.payment;

import com.alonica.pos.application.payment.MidtransWebhookService;
import com.alonica.pos.application.payment.PaymentReconciliationService;
import com.alonica.pos.application.payment.dto.PaymentClientConfig;
import com.alonica.pos.application.payment.dto.WebhookResult;
import com.alonica.pos.presentation.payment.response.PaymentConfigResponse;
import com.alonica.pos.presentation.payment.response.WebhookResponse;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * PaymentController - 결제 게이트웨이 연동 엔드포인트 (인증 없음)
 */
@RestController
@RequestMapping("/payments")
public class PaymentController {

    private final MidtransWebhookService midtransWebhookService;
    private final PaymentReconciliationService paymentReconciliationService;

    public PaymentController(MidtransWebhookService midtransWebhookService,
                             PaymentReconciliationService paymentReconciliationService) {
        this.midtransWebhookService = midtransWebhookService;
        this.paymentReconciliationService = paymentReconciliationService;
    }

    /**
     * Midtrans 결제 알림 수신 (POST /api/payments/midtrans/webhook)
     *
     * 본문을 문자열로 받아 파싱 실패도 서비스에서 200으로 처리한다.
     * - 알 수 없는 주문: 404
     * - 일시적 처리 실패: 500 (게이트웨이가 재전송)
     */
    @PostMapping(value = "/midtrans/webhook", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<WebhookResponse> handleMidtransWebhook(@RequestBody(required = false) String body) {
        WebhookResult result = midtransWebhookService.handle(body);
        return ResponseEntity.ok(new WebhookResponse(result.isApplied(), result.getMessage()));
    }

    /**
     * 클라이언트 결제 설정 (GET /api/payments/config)
     */
    @GetMapping("/config")
    public ResponseEntity<PaymentConfigResponse> getConfig() {
        PaymentClientConfig config = paymentReconciliationService.getClientConfig();
        return ResponseEntity.ok(new PaymentConfigResponse(config.getClientKey(), config.isProduction()));
    }
}
