package com.alonica.pos.domain.deletion;

/**
 * 삭제 승인 요청 알림 Port
 *
 * 실제 전달(푸시, 관리자 알림 벨 등)은 외부 협력자의 책임이며,
 * 알림 실패가 삭제 요청 흐름을 실패시키지 않도록 구현체는 예외를 던지지 않는다.
 */
public interface DeletionNotificationSink {

    void deletionRequested(DeletionRequest request);

    void deletionDecided(DeletionRequest request);
}
