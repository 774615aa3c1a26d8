package com.alonica.pos.application.inventory;

import com.alonica.pos.application.inventory.dto.StockDeductionResult;
import com.alonica.pos.application.inventory.dto.StockLine;
import com.alonica.pos.domain.inventory.BacklogStatus;
import com.alonica.pos.domain.inventory.StockDeductionBacklog;
import com.alonica.pos.domain.inventory.StockDeductionBacklogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * StockDeductionBacklogService - 실패한 재고 차감의 기록과 재처리
 *
 * 서빙 완료 후 재고 차감이 실패하면 주문 상태는 그대로 두고 백로그에 남긴다.
 * 스케줄러가 PENDING 건을 주기적으로 다시 차감하며, 성공하면 RESOLVED로 바꾼다.
 * 재고가 채워질 때까지 재시도가 이어지므로 운영자는 백로그 목록으로 누락을 확인할 수 있다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StockDeductionBacklogService {

    private final StockDeductionBacklogRepository backlogRepository;
    private final StockDeductionService stockDeductionService;

    public StockDeductionBacklog record(Long orderId, List<StockLine> lines, String reason) {
        StockDeductionBacklog saved = backlogRepository.save(
                StockDeductionBacklog.create(orderId, StockLine.toSnapshot(lines), reason));
        log.warn("[StockDeductionBacklogService] 재고 차감 백로그 등록 - backlogId={}, orderId={}, reason={}",
                saved.getBacklogId(), orderId, reason);
        return saved;
    }

    public List<StockDeductionBacklog> findPending() {
        return backlogRepository.findByStatus(BacklogStatus.PENDING);
    }

    /**
     * PENDING 백로그 재처리
     *
     * @return 이번 실행에서 해결된 건수
     */
    @Scheduled(fixedDelayString = "${pos.stock.backlog-retry-interval:60000}",
            initialDelayString = "${pos.stock.backlog-retry-interval:60000}")
    public int retryPending() {
        List<StockDeductionBacklog> pending = findPending();
        if (pending.isEmpty()) {
            return 0;
        }

        int resolved = 0;
        for (StockDeductionBacklog backlog : pending) {
            try {
                StockDeductionResult result = stockDeductionService.deduct(
                        StockLine.fromSnapshot(backlog.getLinesSnapshot()));
                if (result.isSuccess()) {
                    backlog.markResolved();
                    resolved++;
                    log.info("[StockDeductionBacklogService] 백로그 재처리 성공 - backlogId={}, orderId={}",
                            backlog.getBacklogId(), backlog.getOrderId());
                } else {
                    backlog.recordFailedAttempt(result.describeShortages());
                }
            } catch (RuntimeException e) {
                log.warn("[StockDeductionBacklogService] 백로그 재처리 실패 - backlogId={}, error={}",
                        backlog.getBacklogId(), e.getMessage());
                backlog.recordFailedAttempt(e.getMessage());
            }
            backlogRepository.save(backlog);
        }

        log.info("[StockDeductionBacklogService] 백로그 재처리 완료 - 대상 {}건, 해결 {}건", pending.size(), resolved);
        return resolved;
    }
}
