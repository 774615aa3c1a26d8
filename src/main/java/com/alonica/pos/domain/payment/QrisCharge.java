package com.alonica.pos.domain.payment;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * QRIS 결제 생성 결과
 * mock=true 이면 게이트웨이를 호출하지 않은 개발용 모의 결제
 */
@Getter
@Builder
@ToString
public class QrisCharge {

    public static final String MOCK_QRIS_STRING = "MOCK QRIS - Use for development only";

    private final String gatewayOrderId;
    private final String transactionId;
    private final String transactionStatus;
    private final String qrisUrl;
    private final String qrisString;
    private final LocalDateTime expiredAt;
    private final boolean mock;

    /**
     * 게이트웨이 장애/비활성 시 사용할 모의 결제
     */
    public static QrisCharge mock(LocalDateTime now, int expiryMinutes) {
        return QrisCharge.builder()
                .gatewayOrderId("MOCK-" + System.currentTimeMillis())
                .transactionStatus("pending")
                .qrisString(MOCK_QRIS_STRING)
                .expiredAt(now.plusMinutes(expiryMinutes))
                .mock(true)
                .build();
    }
}
