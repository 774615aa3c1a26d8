package com.alonica.pos.presentation.common.auth;

import com.alonica.pos.common.exception.DomainException;
import com.alonica.pos.common.exception.ErrorCode;
import com.alonica.pos.domain.auth.Actor;
import com.alonica.pos.domain.auth.UserRole;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * AuthorizationInterceptor - 요청 헤더를 Actor로 해석하고 핸들러 권한을 검사
 *
 * - X-USER-ID, X-USER-ROLE 헤더는 인증 협력자(게이트웨이)가 채워 보낸다
 * - @RequiresCapability가 붙은 핸들러: 헤더 누락 시 401, 권한 부족 시 403
 * - 해석된 Actor는 요청 속성에 담겨 ActorArgumentResolver가 꺼내 쓴다
 */
@Slf4j
public class AuthorizationInterceptor implements HandlerInterceptor {

    public static final String USER_ID_HEADER = "X-USER-ID";
    public static final String USER_ROLE_HEADER = "X-USER-ROLE";
    public static final String ACTOR_ATTRIBUTE = AuthorizationInterceptor.class.getName() + ".actor";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod)) {
            return true;
        }
        RequiresCapability required = ((HandlerMethod) handler).getMethodAnnotation(RequiresCapability.class);
        if (required == null) {
            return true;
        }

        Actor actor = resolveActor(request);
        if (!actor.can(required.value())) {
            log.warn("[AuthorizationInterceptor] 권한 부족 - userId={}, role={}, required={}",
                    actor.getUserId(), actor.getRole(), required.value());
            throw new DomainException(ErrorCode.FORBIDDEN, "required=" + required.value());
        }
        request.setAttribute(ACTOR_ATTRIBUTE, actor);
        return true;
    }

    private Actor resolveActor(HttpServletRequest request) {
        String userId = request.getHeader(USER_ID_HEADER);
        String role = request.getHeader(USER_ROLE_HEADER);
        if (userId == null || userId.isBlank() || role == null || role.isBlank()) {
            throw new DomainException(ErrorCode.UNAUTHENTICATED);
        }
        try {
            return Actor.of(Long.parseLong(userId.trim()), UserRole.fromString(role));
        } catch (IllegalArgumentException e) {
            throw new DomainException(ErrorCode.UNAUTHENTICATED, e.getMessage());
        }
    }
}
