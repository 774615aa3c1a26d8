package com.alonica.pos.application.deletion.dto;

import com.alonica.pos.application.order.dto.OrderResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 삭제 요청 승인/거절 결과
 * 거절된 경우 order와 log는 null
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeletionDecisionResult {
    private DeletionRequestResult request;
    private OrderResult order;
    private DeletionLogResult log;
}
