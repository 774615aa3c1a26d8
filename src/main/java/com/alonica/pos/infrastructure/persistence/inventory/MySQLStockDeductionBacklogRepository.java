package com.alonica.pos.infrastructure.persistence.inventory;

import com.alonica.pos.domain.inventory.BacklogStatus;
import com.alonica.pos.domain.inventory.StockDeductionBacklog;
import com.alonica.pos.domain.inventory.StockDeductionBacklogRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * MySQL 기반 재고 차감 백로그 Repository 구현
 */
@Repository
public class MySQLStockDeductionBacklogRepository implements StockDeductionBacklogRepository {

    private final StockDeductionBacklogJpaRepository backlogJpaRepository;

    public MySQLStockDeductionBacklogRepository(StockDeductionBacklogJpaRepository backlogJpaRepository) {
        this.backlogJpaRepository = backlogJpaRepository;
    }

    @Override
    public StockDeductionBacklog save(StockDeductionBacklog backlog) {
        return backlogJpaRepository.save(backlog);
    }

    @Override
    public List<StockDeductionBacklog> findByStatus(BacklogStatus status) {
        return backlogJpaRepository.findByStatusOrderByCreatedAtAsc(status);
    }
}
