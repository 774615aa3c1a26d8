package com.alonica.pos.infrastructure.payment.midtrans;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Midtrans Core API 응답 (charge, status 공용)
 */
@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MidtransChargeResponse {

    @JsonProperty("status_code")
    private String statusCode;

    @JsonProperty("status_message")
    private String statusMessage;

    @JsonProperty("transaction_id")
    private String transactionId;

    @JsonProperty("order_id")
    private String orderId;

    @JsonProperty("gross_amount")
    private String grossAmount;

    @JsonProperty("transaction_status")
    private String transactionStatus;

    @JsonProperty("fraud_status")
    private String fraudStatus;

    @JsonProperty("qr_string")
    private String qrString;

    @JsonProperty("expiry_time")
    private String expiryTime;

    @JsonProperty("actions")
    private List<Action> actions;

    @Getter
    @Setter
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Action {
        @JsonProperty("name")
        private String name;

        @JsonProperty("method")
        private String method;

        @JsonProperty("url")
        private String url;
    }

    /**
     * QR 코드 이미지 URL (actions 중 generate-qr-code)
     */
    public String findQrCodeUrl() {
        if (actions == null) {
            return null;
        }
        return actions.stream()
                .filter(action -> "generate-qr-code".equals(action.getName()))
                .map(Action::getUrl)
                .findFirst()
                .orElse(null);
    }
}
