package com.alonica.pos.presentation.openbill.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class PayOpenBillRequest {
    @JsonProperty("payment_method")
    private String paymentMethod;
}
