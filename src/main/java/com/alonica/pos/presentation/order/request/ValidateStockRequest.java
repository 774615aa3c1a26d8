package com.alonica.pos.presentation.order.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 재고 사전 검증 요청 DTO
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ValidateStockRequest {
    @Valid
    @NotNull(message = "items는 배열이어야 합니다")
    private List<OrderItemRequest> items;
}
