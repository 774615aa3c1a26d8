package com.alonica.pos.application.hook;

import com.alonica.pos.application.inventory.StockDeductionBacklogService;
import com.alonica.pos.application.inventory.StockDeductionService;
import com.alonica.pos.application.inventory.dto.StockDeductionResult;
import com.alonica.pos.application.inventory.dto.StockLine;
import com.alonica.pos.domain.order.event.OrderServedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 서빙 완료 시 재료 재고 차감
 *
 * 차감 실패는 주문 상태 변경을 되돌리지 않는다. 실패 건은 백로그에 기록되어 스케줄러가 재시도한다.
 */
@Slf4j
@Component
public class StockDeductionHook implements PostCommitHook<OrderServedEvent> {

    private final StockDeductionService stockDeductionService;
    private final StockDeductionBacklogService backlogService;

    public StockDeductionHook(StockDeductionService stockDeductionService,
                              StockDeductionBacklogService backlogService) {
        this.stockDeductionService = stockDeductionService;
        this.backlogService = backlogService;
    }

    @Override
    public String getName() {
        return "stockDeduction";
    }

    @Override
    public Class<OrderServedEvent> getEventType() {
        return OrderServedEvent.class;
    }

    @Override
    public Optional<String> handle(OrderServedEvent event) {
        List<StockLine> lines = StockLine.fromOrderItems(event.getItems());
        StockDeductionResult result;
        try {
            result = stockDeductionService.deduct(lines);
        } catch (RuntimeException e) {
            backlogService.record(event.getOrderId(), lines, e.getMessage());
            throw e;
        }
        if (result.isSuccess()) {
            return Optional.empty();
        }

        String reason = result.describeShortages();
        log.warn("[StockDeductionHook] 서빙 완료 주문의 재고 차감 실패 - orderId={}, reason={}",
                event.getOrderId(), reason);
        backlogService.record(event.getOrderId(), lines, reason);
        return Optional.of("재고 차감 실패 (재처리 대기): " + reason);
    }
}
