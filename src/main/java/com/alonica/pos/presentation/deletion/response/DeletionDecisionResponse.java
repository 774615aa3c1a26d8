package com.alonica.pos.presentation.deletion.response;

import com.alonica.pos.presentation.order.response.OrderResponse;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 삭제 승인/거절 응답
 * 거절 시 order와 log는 생략된다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeletionDecisionResponse {
    private DeletionRequestResponse request;
    private OrderResponse order;
    private DeletionLogResponse log;
}
