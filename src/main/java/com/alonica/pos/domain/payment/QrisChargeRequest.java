package com.alonica.pos.domain.payment;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * QRIS 결제 생성 요청
 */
@Getter
@Builder
@ToString
public class QrisChargeRequest {

    private final String gatewayOrderId;
    private final long grossAmount;
    private final String customerName;
    private final int expiryMinutes;
    private final List<Line> lines;

    @Getter
    @Builder
    @ToString
    public static class Line {
        private final String id;
        private final String name;
        private final long price;
        private final int quantity;
    }
}
