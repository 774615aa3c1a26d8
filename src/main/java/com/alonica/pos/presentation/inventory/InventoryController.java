package com.alonica.pos.presentation.inventory;

import com.alonica.pos.application.inventory.InventoryQueryService;
import com.alonica.pos.application.inventory.StockDeductionBacklogService;
import com.alonica.pos.domain.auth.Capability;
import com.alonica.pos.presentation.common.auth.RequiresCapability;
import com.alonica.pos.presentation.inventory.response.LowStockItemResponse;
import com.alonica.pos.presentation.inventory.response.StockBacklogResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * InventoryController - 재료 재고 조회 API
 */
@RestController
@RequestMapping("/inventory")
public class InventoryController {

    private final InventoryQueryService inventoryQueryService;
    private final StockDeductionBacklogService backlogService;

    public InventoryController(InventoryQueryService inventoryQueryService,
                               StockDeductionBacklogService backlogService) {
        this.inventoryQueryService = inventoryQueryService;
        this.backlogService = backlogService;
    }

    /**
     * 최소 재고 이하 재료 (GET /api/inventory/low-stock)
     */
    @GetMapping("/low-stock")
    @RequiresCapability(Capability.VIEW_INVENTORY)
    public ResponseEntity<List<LowStockItemResponse>> getLowStockItems() {
        return ResponseEntity.ok(inventoryQueryService.getLowStockItems().stream()
                .map(LowStockItemResponse::from)
                .collect(Collectors.toList()));
    }

    /**
     * 재처리 대기 중인 재고 차감 (GET /api/inventory/deduction-backlog)
     */
    @GetMapping("/deduction-backlog")
    @RequiresCapability(Capability.VIEW_REPORTS)
    public ResponseEntity<List<StockBacklogResponse>> getPendingBacklog() {
        return ResponseEntity.ok(backlogService.findPending().stream()
                .map(StockBacklogResponse::from)
                .collect(Collectors.toList()));
    }
}
