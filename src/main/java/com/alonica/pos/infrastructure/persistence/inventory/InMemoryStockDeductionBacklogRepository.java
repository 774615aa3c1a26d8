package com.alonica.pos.infrastructure.persistence.inventory;

import com.alonica.pos.domain.inventory.BacklogStatus;
import com.alonica.pos.domain.inventory.StockDeductionBacklog;
import com.alonica.pos.domain.inventory.StockDeductionBacklogRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * InMemoryStockDeductionBacklogRepository - 재고 차감 백로그 구현체 (인메모리)
 */
@Repository
public class InMemoryStockDeductionBacklogRepository implements StockDeductionBacklogRepository {

    private final ConcurrentHashMap<Long, StockDeductionBacklog> backlogs = new ConcurrentHashMap<>();
    private long backlogIdSequence = 0L;

    @Override
    public StockDeductionBacklog save(StockDeductionBacklog backlog) {
        if (backlog.getBacklogId() == null) {
            synchronized (this) {
                StockDeductionBacklog saved = backlog.toBuilder().backlogId(++backlogIdSequence).build();
                backlogs.put(saved.getBacklogId(), saved);
                return saved;
            }
        }
        backlogs.put(backlog.getBacklogId(), backlog);
        return backlog;
    }

    @Override
    public List<StockDeductionBacklog> findByStatus(BacklogStatus status) {
        return backlogs.values().stream()
                .filter(backlog -> backlog.getStatus() == status)
                .sorted(Comparator.comparing(StockDeductionBacklog::getCreatedAt))
                .collect(Collectors.toList());
    }
}
