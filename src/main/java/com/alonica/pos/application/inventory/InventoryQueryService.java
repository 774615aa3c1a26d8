package com.alonica.pos.application.inventory;

import com.alonica.pos.application.inventory.dto.LowStockResponse;
import com.alonica.pos.domain.inventory.InventoryRepository;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 재고 조회 서비스 (재고 부족 목록)
 */
@Service
public class InventoryQueryService {

    private final InventoryRepository inventoryRepository;

    public InventoryQueryService(InventoryRepository inventoryRepository) {
        this.inventoryRepository = inventoryRepository;
    }

    public List<LowStockResponse> getLowStockItems() {
        return inventoryRepository.findLowStock().stream()
                .map(LowStockResponse::from)
                .collect(Collectors.toList());
    }
}
