package com.alonica.pos.infrastructure.payment.midtrans;

import com.alonica.pos.domain.payment.GatewayTransactionStatus;
import com.alonica.pos.domain.payment.PaymentGateway;
import com.alonica.pos.domain.payment.PaymentGatewayException;
import com.alonica.pos.domain.payment.QrisCharge;
import com.alonica.pos.domain.payment.QrisChargeRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * MidtransPaymentGateway - Midtrans Core API 기반 QRIS 결제 연동
 *
 * 호출 방식:
 * - POST {base}/v2/charge (payment_type=qris, acquirer=gopay)
 * - GET  {base}/v2/{orderId}/status
 * - Basic 인증: base64(serverKey + ":")
 *
 * 재시도 정책:
 * - 연결 실패/타임아웃(ResourceAccessException)만 1회 재시도
 * - 4XX/5XX 응답은 재시도하지 않고 PaymentGatewayException으로 변환
 */
@Slf4j
@Component
public class MidtransPaymentGateway implements PaymentGateway {

    static final String SANDBOX_BASE_URL = "https://api.sandbox.midtrans.com";
    static final String PRODUCTION_BASE_URL = "https://api.midtrans.com";

    private static final DateTimeFormatter EXPIRY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final RestTemplate restTemplate;
    private final String serverKey;
    private final String clientKey;
    private final boolean production;
    private final String baseUrl;
    private final MidtransSignatureVerifier signatureVerifier;

    public MidtransPaymentGateway(@Qualifier("midtransRestTemplate") RestTemplate restTemplate,
                                  @Value("${pos.payment.midtrans.server-key:}") String serverKey,
                                  @Value("${pos.payment.midtrans.client-key:}") String clientKey,
                                  @Value("${pos.payment.midtrans.production:false}") boolean production,
                                  @Value("${pos.payment.midtrans.base-url:}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.serverKey = serverKey;
        this.clientKey = clientKey;
        this.production = production;
        this.baseUrl = (baseUrl == null || baseUrl.isBlank())
                ? (production ? PRODUCTION_BASE_URL : SANDBOX_BASE_URL)
                : baseUrl;
        this.signatureVerifier = new MidtransSignatureVerifier(serverKey);
    }

    @Override
    public boolean isEnabled() {
        return serverKey != null && !serverKey.isBlank();
    }

    @Override
    @Retryable(retryFor = ResourceAccessException.class, maxAttempts = 2, backoff = @Backoff(delay = 300))
    public QrisCharge createQrisCharge(QrisChargeRequest request) {
        ensureEnabled();
        log.info("[MidtransPaymentGateway] QRIS 결제 생성 요청 - gatewayOrderId={}, grossAmount={}",
                request.getGatewayOrderId(), request.getGrossAmount());

        HttpEntity<Map<String, Object>> entity = new HttpEntity<>(buildChargeBody(request), authHeaders());
        MidtransChargeResponse response;
        try {
            response = restTemplate.postForObject(baseUrl + "/v2/charge", entity, MidtransChargeResponse.class);
        } catch (HttpStatusCodeException e) {
            log.warn("[MidtransPaymentGateway] QRIS 결제 생성 실패 - status={}, body={}",
                    e.getStatusCode(), e.getResponseBodyAsString());
            throw new PaymentGatewayException("QRIS 결제 생성 실패: " + e.getStatusCode(), e);
        }
        if (response == null || response.getTransactionId() == null) {
            throw new PaymentGatewayException("QRIS 결제 생성 응답이 비어 있습니다: "
                    + (response != null ? response.getStatusMessage() : "null"));
        }

        log.info("[MidtransPaymentGateway] QRIS 결제 생성 완료 - gatewayOrderId={}, transactionId={}, status={}",
                request.getGatewayOrderId(), response.getTransactionId(), response.getTransactionStatus());

        return QrisCharge.builder()
                .gatewayOrderId(request.getGatewayOrderId())
                .transactionId(response.getTransactionId())
                .transactionStatus(response.getTransactionStatus())
                .qrisUrl(response.findQrCodeUrl())
                .qrisString(response.getQrString())
                .expiredAt(parseExpiry(response.getExpiryTime(), request.getExpiryMinutes()))
                .mock(false)
                .build();
    }

    @Override
    @Retryable(retryFor = ResourceAccessException.class, maxAttempts = 2, backoff = @Backoff(delay = 300))
    public GatewayTransactionStatus queryStatus(String gatewayOrderId) {
        ensureEnabled();
        MidtransChargeResponse response;
        try {
            response = restTemplate.exchange(
                    baseUrl + "/v2/" + gatewayOrderId + "/status",
                    HttpMethod.GET,
                    new HttpEntity<>(authHeaders()),
                    MidtransChargeResponse.class).getBody();
        } catch (HttpStatusCodeException e) {
            log.warn("[MidtransPaymentGateway] 거래 상태 조회 실패 - gatewayOrderId={}, status={}",
                    gatewayOrderId, e.getStatusCode());
            throw new PaymentGatewayException("거래 상태 조회 실패: " + e.getStatusCode(), e);
        }
        if (response == null) {
            throw new PaymentGatewayException("거래 상태 조회 응답이 비어 있습니다: " + gatewayOrderId);
        }

        log.debug("[MidtransPaymentGateway] 거래 상태 조회 - gatewayOrderId={}, status={}",
                gatewayOrderId, response.getTransactionStatus());

        return GatewayTransactionStatus.builder()
                .gatewayOrderId(gatewayOrderId)
                .transactionId(response.getTransactionId())
                .transactionStatus(response.getTransactionStatus())
                .statusCode(response.getStatusCode())
                .grossAmount(response.getGrossAmount())
                .fraudStatus(response.getFraudStatus())
                .build();
    }

    @Override
    public boolean verifySignature(String gatewayOrderId, String statusCode, String grossAmount, String signatureKey) {
        return signatureVerifier.verify(gatewayOrderId, statusCode, grossAmount, signatureKey);
    }

    @Override
    public String getClientKey() {
        return clientKey;
    }

    @Override
    public boolean isProduction() {
        return production;
    }

    private void ensureEnabled() {
        if (!isEnabled()) {
            throw new PaymentGatewayException("Midtrans 서버 키가 설정되지 않았습니다");
        }
    }

    private HttpHeaders authHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        String token = Base64.getEncoder().encodeToString((serverKey + ":").getBytes(StandardCharsets.UTF_8));
        headers.set(HttpHeaders.AUTHORIZATION, "Basic " + token);
        return headers;
    }

    private Map<String, Object> buildChargeBody(QrisChargeRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("payment_type", "qris");
        body.put("qris", Map.of("acquirer", "gopay"));

        Map<String, Object> transactionDetails = new LinkedHashMap<>();
        transactionDetails.put("order_id", request.getGatewayOrderId());
        transactionDetails.put("gross_amount", request.getGrossAmount());
        body.put("transaction_details", transactionDetails);

        Map<String, Object> customerDetails = new LinkedHashMap<>();
        customerDetails.put("first_name", request.getCustomerName());
        customerDetails.put("phone", "");
        body.put("customer_details", customerDetails);

        List<Map<String, Object>> itemDetails = request.getLines().stream()
                .map(line -> {
                    Map<String, Object> item = new LinkedHashMap<>();
                    item.put("id", line.getId());
                    item.put("name", line.getName());
                    item.put("price", line.getPrice());
                    item.put("quantity", line.getQuantity());
                    return item;
                })
                .collect(Collectors.toCollection(ArrayList::new));
        // Midtrans는 item_details 합계와 gross_amount가 다르면 결제를 거절한다 (할인 금액은 음수 항목으로 보정)
        long itemsTotal = request.getLines().stream()
                .mapToLong(line -> line.getPrice() * line.getQuantity())
                .sum();
        long difference = request.getGrossAmount() - itemsTotal;
        if (difference != 0) {
            Map<String, Object> adjustment = new LinkedHashMap<>();
            adjustment.put("id", difference < 0 ? "DISCOUNT" : "ADJUSTMENT");
            adjustment.put("name", difference < 0 ? "Discount" : "Adjustment");
            adjustment.put("price", difference);
            adjustment.put("quantity", 1);
            itemDetails.add(adjustment);
        }
        body.put("item_details", itemDetails);

        Map<String, Object> customExpiry = new LinkedHashMap<>();
        customExpiry.put("expiry_duration", request.getExpiryMinutes());
        customExpiry.put("unit", "minute");
        body.put("custom_expiry", customExpiry);
        return body;
    }

    private LocalDateTime parseExpiry(String expiryTime, int expiryMinutes) {
        if (expiryTime != null && !expiryTime.isBlank()) {
            try {
                return LocalDateTime.parse(expiryTime.trim(), EXPIRY_FORMAT);
            } catch (DateTimeParseException e) {
                log.warn("[MidtransPaymentGateway] 만료 시각 형식 오류, 기본 만료 시간 사용 - expiryTime={}", expiryTime);
            }
        }
        return LocalDateTime.now().plusMinutes(expiryMinutes);
    }
}
