package com.alonica.pos.presentation.common.auth;

import com.alonica.pos.domain.auth.Capability;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 핸들러 실행에 필요한 권한 선언
 *
 * 붙어 있지 않은 핸들러는 인증 없이 호출 가능 (QRIS 주문 생성, 웹훅 등)
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RequiresCapability {
    Capability value();
}
