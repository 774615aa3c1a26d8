package com.alonica.pos.presentation.payment.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class PaymentConfigResponse {
    @JsonProperty("client_key")
    private String clientKey;

    private boolean production;
}
