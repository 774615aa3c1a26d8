package com.alonica.pos.application.payment.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 웹훅 처리 결과 (게이트웨이에는 항상 200으로 응답되는 경우)
 */
@Getter
@AllArgsConstructor
public class WebhookResult {
    private final boolean applied;
    private final String message;

    public static WebhookResult applied(String message) {
        return new WebhookResult(true, message);
    }

    public static WebhookResult ignored(String message) {
        return new WebhookResult(false, message);
    }
}
