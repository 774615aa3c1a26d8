package com.alonica.pos.presentation.order.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 주문 생성 요청 DTO (현금 / QRIS 공용)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderRequest {
    @NotBlank(message = "고객 이름은 필수입니다")
    @JsonProperty("customer_name")
    private String customerName;

    @JsonProperty("table_number")
    private String tableNumber;

    @Valid
    @NotEmpty(message = "주문 항목이 최소 1개 이상 필요합니다")
    private List<OrderItemRequest> items;

    @Min(value = 0, message = "할인 금액은 음수가 될 수 없습니다")
    private Long discount;

    /**
     * 현금 주문에서 받은 금액 (생략 시 합계와 동일)
     */
    @Min(value = 0, message = "받은 금액은 음수가 될 수 없습니다")
    private Long received;
}
