package com.alonica.pos.presentation.openbill.response;

import com.alonica.pos.presentation.order.response.OrderResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 오픈 빌 응답
 * created: 새 빌이 만들어졌으면 true, 기존 빌에 반영됐으면 false
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenBillResponse {
    private OrderResponse order;
    private boolean created;
}
