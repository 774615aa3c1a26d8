package com.alonica.pos.domain.payment;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 게이트웨이 거래 상태 (상태 조회 응답 또는 웹훅 본문)
 */
@Getter
@Builder
@ToString
public class GatewayTransactionStatus {

    private final String gatewayOrderId;
    private final String transactionId;
    private final String transactionStatus;
    private final String statusCode;
    private final String grossAmount;
    private final String fraudStatus;
}
