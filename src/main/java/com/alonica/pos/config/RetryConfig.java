package com.alonica.pos.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/**
 * RetryConfig - Spring Retry 설정
 *
 * 결제 게이트웨이 호출(MidtransPaymentGateway)의 @Retryable을 활성화한다.
 * 연결 실패/타임아웃만 재시도하며 재시도 횟수와 대기 시간은 각 메서드에서 정의한다.
 */
@Configuration
@EnableRetry
public class RetryConfig {
}
