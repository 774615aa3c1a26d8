package com.alonica.pos.application.hook;

import com.alonica.pos.application.inventory.StockDeductionBacklogService;
import com.alonica.pos.application.inventory.StockDeductionService;
import com.alonica.pos.domain.inventory.BacklogStatus;
import com.alonica.pos.domain.inventory.InventoryItem;
import com.alonica.pos.domain.inventory.StockDeductionBacklog;
import com.alonica.pos.domain.menu.MenuItemIngredient;
import com.alonica.pos.domain.order.OrderItem;
import com.alonica.pos.domain.order.event.OrderServedEvent;
import com.alonica.pos.infrastructure.persistence.inventory.InMemoryInventoryRepository;
import com.alonica.pos.infrastructure.persistence.inventory.InMemoryStockDeductionBacklogRepository;
import com.alonica.pos.infrastructure.persistence.menu.InMemoryRecipeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 서빙 완료 재고 차감 훅과 백로그 재처리 테스트
 *
 * 레시피: 메뉴 1 = 계란 2개, 초기 재고 3개, 보충 후 11개
 */
@DisplayName("StockDeductionHook / StockDeductionBacklogService 테스트")
class StockDeductionHookTest {

    private InMemoryInventoryRepository inventoryRepository;
    private StockDeductionBacklogService backlogService;
    private StockDeductionHook hook;
    private Long eggId;

    @BeforeEach
    void setUp() {
        inventoryRepository = new InMemoryInventoryRepository();
        InMemoryRecipeRepository recipeRepository = new InMemoryRecipeRepository();
        StockDeductionService stockDeductionService = new StockDeductionService(recipeRepository, inventoryRepository);
        backlogService = new StockDeductionBacklogService(new InMemoryStockDeductionBacklogRepository(),
                stockDeductionService);
        hook = new StockDeductionHook(stockDeductionService, backlogService);

        eggId = inventoryRepository.save(InventoryItem.builder()
                .name("Telur")
                .currentStock(new BigDecimal("3"))
                .minStock(BigDecimal.ONE)
                .unit("pcs")
                .build()).getInventoryItemId();
        recipeRepository.save(MenuItemIngredient.builder()
                .menuItemId(1L)
                .inventoryItemId(eggId)
                .quantityNeeded(new BigDecimal("2"))
                .build());
    }

    private static OrderServedEvent served(Long orderId, int quantity) {
        return new OrderServedEvent(orderId, List.of(OrderItem.createOrderItem(1L, "Telur Dadar", 12000L, quantity, null)));
    }

    private BigDecimal eggStock() {
        return inventoryRepository.findById(eggId).orElseThrow().getCurrentStock();
    }

    @Test
    @DisplayName("재고가 충분하면 차감하고 경고 없음")
    void testHandle_Success() {
        // When
        Optional<String> warning = hook.handle(served(5001L, 1));

        // Then
        assertTrue(warning.isEmpty());
        assertEquals(0, BigDecimal.ONE.compareTo(eggStock()));
        assertTrue(backlogService.findPending().isEmpty());
    }

    @Test
    @DisplayName("재고 부족 - 경고를 반환하고 백로그에 기록, 재고는 그대로")
    void testHandle_ShortageGoesToBacklog() {
        // When
        Optional<String> warning = hook.handle(served(5002L, 2));

        // Then
        assertTrue(warning.isPresent());
        assertTrue(warning.get().contains("Telur"));
        assertEquals(0, new BigDecimal("3").compareTo(eggStock()));
        List<StockDeductionBacklog> pending = backlogService.findPending();
        assertEquals(1, pending.size());
        assertEquals(5002L, pending.get(0).getOrderId());
        assertEquals("1:2", pending.get(0).getLinesSnapshot());
    }

    @Test
    @DisplayName("백로그 재처리 - 재고가 채워지면 RESOLVED, 부족하면 시도 횟수만 증가")
    void testRetryPending() {
        // Given
        hook.handle(served(5003L, 2));

        // When: 여전히 부족
        int firstRun = backlogService.retryPending();

        // Then
        assertEquals(0, firstRun);
        assertEquals(2, backlogService.findPending().get(0).getAttempts());

        // When: 재고 보충 후 재처리
        InventoryItem egg = inventoryRepository.findById(eggId).orElseThrow();
        inventoryRepository.save(egg.toBuilder().currentStock(new BigDecimal("11")).build());
        StockDeductionBacklog backlog = backlogService.findPending().get(0);
        int secondRun = backlogService.retryPending();

        // Then
        assertEquals(1, secondRun);
        assertEquals(BacklogStatus.RESOLVED, backlog.getStatus());
        assertTrue(backlogService.findPending().isEmpty());
        assertEquals(0, new BigDecimal("9").compareTo(eggStock()));
    }
}
