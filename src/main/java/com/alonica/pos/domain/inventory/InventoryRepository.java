package com.alonica.pos.domain.inventory;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * InventoryRepository - 재료 재고 영속성 Port Interface
 */
public interface InventoryRepository {

    InventoryItem save(InventoryItem item);

    Optional<InventoryItem> findById(Long inventoryItemId);

    List<InventoryItem> findAllByIds(Collection<Long> inventoryItemIds);

    /**
     * currentStock <= minStock 인 재료 목록
     */
    List<InventoryItem> findLowStock();

    /**
     * 재료별 차감량을 한 번에 차감 (전부 성공 또는 전부 실패)
     *
     * 각 재료는 "stock >= 차감량" 조건부 연산으로 차감되며,
     * 하나라도 조건을 만족하지 못하면 이미 차감한 재료까지 모두 되돌린다.
     *
     * @param requirements inventoryItemId → 차감량
     * @throws StockDeductionConflictException 검증 이후 다른 요청이 재고를 먼저 소진한 경우
     */
    void deductAll(Map<Long, BigDecimal> requirements);
}
