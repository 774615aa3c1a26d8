package com.alonica.pos.application.payment.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 클라이언트 노출용 게이트웨이 설정
 */
@Getter
@AllArgsConstructor
public class PaymentClientConfig {
    private final String clientKey;
    private final boolean production;
}
