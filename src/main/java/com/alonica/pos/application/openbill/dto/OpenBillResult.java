package com.alonica.pos.application.openbill.dto;

import com.alonica.pos.application.order.dto.OrderResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 오픈 빌 처리 결과
 * created: 스마트 병합에서 새 빌을 만들었는지(true) 기존 빌에 추가했는지(false)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenBillResult {
    private OrderResult order;
    private boolean created;
}
