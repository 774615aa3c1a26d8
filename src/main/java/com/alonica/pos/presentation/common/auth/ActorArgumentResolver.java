package com.alonica.pos.presentation.common.auth;

import com.alonica.pos.common.exception.DomainException;
import com.alonica.pos.common.exception.ErrorCode;
import com.alonica.pos.domain.auth.Actor;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * 컨트롤러의 Actor 파라미터에 인터셉터가 해석한 사용자를 주입
 */
public class ActorArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return Actor.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        Object actor = webRequest.getAttribute(AuthorizationInterceptor.ACTOR_ATTRIBUTE,
                RequestAttributes.SCOPE_REQUEST);
        if (actor == null) {
            throw new DomainException(ErrorCode.UNAUTHENTICATED);
        }
        return actor;
    }
}
