package com.alonica.pos.presentation.openbill.request;

import com.alonica.pos.presentation.order.request.OrderItemRequest;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 오픈 빌 생성 / 스마트 생성 요청 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenBillRequest {
    @NotBlank(message = "고객 이름은 필수입니다")
    @JsonProperty("customer_name")
    private String customerName;

    @JsonProperty("table_number")
    private String tableNumber;

    @Valid
    @NotEmpty(message = "주문 항목이 최소 1개 이상 필요합니다")
    private List<OrderItemRequest> items;

    /**
     * CASH | QRIS (생략 시 CASH)
     */
    @JsonProperty("payment_method")
    private String paymentMethod;
}
