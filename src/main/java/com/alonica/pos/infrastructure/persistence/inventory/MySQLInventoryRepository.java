package com.alonica.pos.infrastructure.persistence.inventory;

import com.alonica.pos.domain.inventory.InventoryItem;
import com.alonica.pos.domain.inventory.InventoryRepository;
import com.alonica.pos.domain.inventory.StockDeductionConflictException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.*;

/**
 * MySQL 기반 Inventory Repository 구현
 */
@Repository
public class MySQLInventoryRepository implements InventoryRepository {

    private final InventoryItemJpaRepository inventoryItemJpaRepository;

    public MySQLInventoryRepository(InventoryItemJpaRepository inventoryItemJpaRepository) {
        this.inventoryItemJpaRepository = inventoryItemJpaRepository;
    }

    @Override
    public InventoryItem save(InventoryItem item) {
        return inventoryItemJpaRepository.save(item);
    }

    @Override
    public Optional<InventoryItem> findById(Long inventoryItemId) {
        return inventoryItemJpaRepository.findById(inventoryItemId);
    }

    @Override
    public List<InventoryItem> findAllByIds(Collection<Long> inventoryItemIds) {
        return inventoryItemJpaRepository.findAllById(inventoryItemIds);
    }

    @Override
    public List<InventoryItem> findLowStock() {
        return inventoryItemJpaRepository.findLowStock();
    }

    /**
     * 재료 ID 오름차순으로 조건부 차감 (행 잠금 순서를 고정하여 교착 방지)
     * 하나라도 0건이면 예외로 트랜잭션 전체를 롤백한다.
     */
    @Override
    @Transactional
    public void deductAll(Map<Long, BigDecimal> requirements) {
        LocalDateTime now = LocalDateTime.now();
        for (Map.Entry<Long, BigDecimal> entry : new TreeMap<>(requirements).entrySet()) {
            int updated = inventoryItemJpaRepository.deductIfAvailable(entry.getKey(), entry.getValue(), now);
            if (updated == 0) {
                throw new StockDeductionConflictException(entry.getKey());
            }
        }
    }
}
