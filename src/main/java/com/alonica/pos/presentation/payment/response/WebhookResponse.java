package com.alonica.pos.presentation.payment.response;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 웹훅 수신 응답
 * 서명 불일치나 파싱 실패도 applied=false로 200 응답한다 (게이트웨이 재전송 방지).
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class WebhookResponse {
    private boolean applied;
    private String message;
}
