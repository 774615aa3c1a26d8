package com.alonica.pos.presentation.openbill.request;

import com.alonica.pos.presentation.order.request.OrderItemRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 오픈 빌 항목 추가/교체 요청 DTO
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class OpenBillItemsRequest {
    @Valid
    @NotEmpty(message = "주문 항목이 최소 1개 이상 필요합니다")
    private List<OrderItemRequest> items;
}
