package com.alonica.pos.infrastructure.payment.midtrans;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * MidtransClientConfig - 결제 게이트웨이 HTTP 클라이언트 설정
 *
 * 게이트웨이 장애가 주문 생성을 붙잡지 않도록 연결/응답 타임아웃을 짧게 둔다.
 * - connect-timeout: 기본 3초
 * - read-timeout: 기본 5초
 */
@Configuration
public class MidtransClientConfig {

    @Bean
    public RestTemplate midtransRestTemplate(
            @Value("${pos.payment.midtrans.connect-timeout-ms:3000}") int connectTimeoutMs,
            @Value("${pos.payment.midtrans.read-timeout-ms:5000}") int readTimeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(requestFactory);
    }
}
