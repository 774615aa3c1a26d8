package com.alonica.pos.infrastructure.notification;

import com.alonica.pos.domain.deletion.DeletionNotificationSink;
import com.alonica.pos.domain.deletion.DeletionRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 로깅 기반 삭제 승인 알림
 *
 * 관리자 화면은 GET /api/deletion-requests?status=PENDING 으로 대기 목록을 가져가므로
 * 여기서는 운영 로그에 요청/결정을 남기는 것으로 충분하다.
 */
@Slf4j
@Component
public class LoggingDeletionNotificationSink implements DeletionNotificationSink {

    @Override
    public void deletionRequested(DeletionRequest request) {
        log.warn("[삭제 승인 요청] requestId={}, orderId={}, itemIndex={}, item={}, 요청자={}, 사유={}",
                request.getRequestId(), request.getOrderId(), request.getItemIndex(),
                request.getItemSnapshot().getName(), request.getRequestedBy(), request.getReason());
    }

    @Override
    public void deletionDecided(DeletionRequest request) {
        log.info("[삭제 요청 처리] requestId={}, orderId={}, status={}, 승인자={}",
                request.getRequestId(), request.getOrderId(), request.getStatus(), request.getAuthorizedBy());
    }
}
