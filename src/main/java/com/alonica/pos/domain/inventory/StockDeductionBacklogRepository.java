package com.alonica.pos.domain.inventory;

import java.util.List;

/**
 * 재고 차감 백로그 영속성 Port
 */
public interface StockDeductionBacklogRepository {

    StockDeductionBacklog save(StockDeductionBacklog backlog);

    List<StockDeductionBacklog> findByStatus(BacklogStatus status);
}
