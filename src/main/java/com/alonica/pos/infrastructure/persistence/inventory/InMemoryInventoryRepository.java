package com.alonica.pos.infrastructure.persistence.inventory;

import com.alonica.pos.domain.inventory.InventoryItem;
import com.alonica.pos.domain.inventory.InventoryRepository;
import com.alonica.pos.domain.inventory.StockDeductionConflictException;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * InMemoryInventoryRepository - 재고 저장소 구현체 (인메모리)
 *
 * deductAll은 저장소 단위 잠금 안에서 전체 검증 후 차감하므로 부분 차감이 남지 않는다.
 */
@Repository
public class InMemoryInventoryRepository implements InventoryRepository {

    private final ConcurrentHashMap<Long, InventoryItem> items = new ConcurrentHashMap<>();
    private long inventoryItemIdSequence = 0L;

    @Override
    public InventoryItem save(InventoryItem item) {
        if (item.getInventoryItemId() == null) {
            synchronized (this) {
                InventoryItem saved = item.toBuilder().inventoryItemId(++inventoryItemIdSequence).build();
                items.put(saved.getInventoryItemId(), saved);
                return saved;
            }
        }
        items.put(item.getInventoryItemId(), item);
        return item;
    }

    @Override
    public Optional<InventoryItem> findById(Long inventoryItemId) {
        return Optional.ofNullable(items.get(inventoryItemId));
    }

    @Override
    public List<InventoryItem> findAllByIds(Collection<Long> inventoryItemIds) {
        return inventoryItemIds.stream()
                .map(items::get)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    @Override
    public List<InventoryItem> findLowStock() {
        return items.values().stream()
                .filter(InventoryItem::isLowStock)
                .sorted(Comparator.comparing(InventoryItem::getName))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void deductAll(Map<Long, BigDecimal> requirements) {
        for (Map.Entry<Long, BigDecimal> entry : requirements.entrySet()) {
            InventoryItem item = items.get(entry.getKey());
            if (item == null || !item.hasEnough(entry.getValue())) {
                throw new StockDeductionConflictException(entry.getKey());
            }
        }
        requirements.forEach((inventoryItemId, quantity) -> items.get(inventoryItemId).deduct(quantity));
    }
}
