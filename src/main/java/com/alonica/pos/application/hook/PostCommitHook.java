package com.alonica.pos.application.hook;

import java.util.Optional;

/**
 * PostCommitHook - 커밋 이후 실행되는 부가 작업 (재고 차감, 매출 재집계 등)
 *
 * 규칙:
 * - 주 트랜잭션이 커밋된 뒤에만 호출된다
 * - 훅 실패는 호출한 요청을 실패시키지 않는다 (PostCommitHookDispatcher가 격리)
 *
 * @param <E> 처리하는 이벤트 타입
 */
public interface PostCommitHook<E> {

    String getName();

    Class<E> getEventType();

    /**
     * @return 응답에 노출할 경고 메시지 (정상 처리 시 empty)
     */
    Optional<String> handle(E event);
}
