package com.alonica.pos.application.hook;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostCommitHookDispatcher - 등록된 훅을 순서대로 실행하고 실패를 격리
 *
 * 각 훅은 독립적으로 try/catch 되며, 한 훅의 실패가 다른 훅이나 호출자에게 전파되지 않는다.
 * 실패와 경고는 로그로 남기고 경고 목록으로 반환한다.
 */
@Component
public class PostCommitHookDispatcher {

    private static final Logger log = LoggerFactory.getLogger(PostCommitHookDispatcher.class);

    private final List<PostCommitHook<?>> hooks;

    public PostCommitHookDispatcher(List<PostCommitHook<?>> hooks) {
        this.hooks = List.copyOf(hooks);
    }

    /**
     * 이벤트 타입이 일치하는 모든 훅 실행
     *
     * @return 훅이 남긴 경고 메시지 목록
     */
    public List<String> dispatch(Object event) {
        List<String> warnings = new ArrayList<>();
        for (PostCommitHook<?> hook : hooks) {
            if (!hook.getEventType().isInstance(event)) {
                continue;
            }
            try {
                invoke(hook, event).ifPresent(warnings::add);
            } catch (Exception e) {
                log.warn("[PostCommitHookDispatcher] 훅 실행 실패 - hook={}, event={}, error={}",
                        hook.getName(), event.getClass().getSimpleName(), e.getMessage(), e);
                warnings.add(hook.getName() + " 실패: " + e.getMessage());
            }
        }
        return warnings;
    }

    private <E> Optional<String> invoke(PostCommitHook<E> hook, Object event) {
        return hook.handle(hook.getEventType().cast(event));
    }
}
