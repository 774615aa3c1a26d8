package com.alonica.pos;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Alonica POS 애플리케이션 메인 클래스
 *
 * 활성화된 기능:
 * - @EnableScheduling: 재고 차감 백로그 재처리 스케줄러
 * - @EnableAspectJAutoProxy: @Retryable, @Transactional 프록시
 */
@EnableScheduling
@EnableAspectJAutoProxy
@SpringBootApplication
public class PosApplication {

    public static void main(String[] args) {
        SpringApplication.run(PosApplication.class, args);
    }

}
