package com.alonica.pos.infrastructure.persistence.inventory;

import com.alonica.pos.domain.inventory.BacklogStatus;
import com.alonica.pos.domain.inventory.StockDeductionBacklog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * StockDeductionBacklog JPA Repository
 */
public interface StockDeductionBacklogJpaRepository extends JpaRepository<StockDeductionBacklog, Long> {

    List<StockDeductionBacklog> findByStatusOrderByCreatedAtAsc(BacklogStatus status);
}
