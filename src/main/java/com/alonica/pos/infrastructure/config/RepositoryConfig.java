package com.alonica.pos.infrastructure.config;

import com.alonica.pos.domain.deletion.DeletionLogRepository;
import com.alonica.pos.domain.deletion.DeletionRequestRepository;
import com.alonica.pos.domain.expense.ExpenseRepository;
import com.alonica.pos.domain.inventory.InventoryRepository;
import com.alonica.pos.domain.inventory.StockDeductionBacklogRepository;
import com.alonica.pos.domain.menu.MenuItemRepository;
import com.alonica.pos.domain.menu.RecipeRepository;
import com.alonica.pos.domain.order.OrderRepository;
import com.alonica.pos.domain.refund.RefundRepository;
import com.alonica.pos.domain.report.DailyReportRepository;
import com.alonica.pos.domain.shift.CashMovementRepository;
import com.alonica.pos.domain.shift.ShiftRepository;
import com.alonica.pos.infrastructure.config.database.StorageBackendSelector;
import com.alonica.pos.infrastructure.persistence.deletion.InMemoryDeletionLogRepository;
import com.alonica.pos.infrastructure.persistence.deletion.InMemoryDeletionRequestRepository;
import com.alonica.pos.infrastructure.persistence.deletion.MySQLDeletionLogRepository;
import com.alonica.pos.infrastructure.persistence.deletion.MySQLDeletionRequestRepository;
import com.alonica.pos.infrastructure.persistence.expense.InMemoryExpenseRepository;
import com.alonica.pos.infrastructure.persistence.expense.MySQLExpenseRepository;
import com.alonica.pos.infrastructure.persistence.inventory.InMemoryInventoryRepository;
import com.alonica.pos.infrastructure.persistence.inventory.InMemoryStockDeductionBacklogRepository;
import com.alonica.pos.infrastructure.persistence.inventory.MySQLInventoryRepository;
import com.alonica.pos.infrastructure.persistence.inventory.MySQLStockDeductionBacklogRepository;
import com.alonica.pos.infrastructure.persistence.menu.InMemoryMenuItemRepository;
import com.alonica.pos.infrastructure.persistence.menu.InMemoryRecipeRepository;
import com.alonica.pos.infrastructure.persistence.menu.MySQLMenuItemRepository;
import com.alonica.pos.infrastructure.persistence.menu.MySQLRecipeRepository;
import com.alonica.pos.infrastructure.persistence.order.InMemoryOrderRepository;
import com.alonica.pos.infrastructure.persistence.order.MySQLOrderRepository;
import com.alonica.pos.infrastructure.persistence.refund.InMemoryRefundRepository;
import com.alonica.pos.infrastructure.persistence.refund.MySQLRefundRepository;
import com.alonica.pos.infrastructure.persistence.report.InMemoryDailyReportRepository;
import com.alonica.pos.infrastructure.persistence.report.MySQLDailyReportRepository;
import com.alonica.pos.infrastructure.persistence.shift.InMemoryCashMovementRepository;
import com.alonica.pos.infrastructure.persistence.shift.InMemoryShiftRepository;
import com.alonica.pos.infrastructure.persistence.shift.MySQLCashMovementRepository;
import com.alonica.pos.infrastructure.persistence.shift.MySQLShiftRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * RepositoryConfig - 각 Port에 주입될 저장소 구현체 선택
 *
 * MySQL 구현체와 인메모리 구현체가 모두 Bean으로 등록되어 있으며,
 * StorageBackendSelector가 한 번 내린 결정에 따라 @Primary Port Bean을 노출한다.
 * Application 계층은 Port 인터페이스만 주입받으므로 어느 저장소인지 알지 못한다.
 */
@Configuration
public class RepositoryConfig {

    @Bean
    @Primary
    public OrderRepository orderRepository(StorageBackendSelector selector,
                                           MySQLOrderRepository database, InMemoryOrderRepository memory) {
        return selector.select(database, memory);
    }

    @Bean
    @Primary
    public MenuItemRepository menuItemRepository(StorageBackendSelector selector,
                                                 MySQLMenuItemRepository database, InMemoryMenuItemRepository memory) {
        return selector.select(database, memory);
    }

    @Bean
    @Primary
    public RecipeRepository recipeRepository(StorageBackendSelector selector,
                                             MySQLRecipeRepository database, InMemoryRecipeRepository memory) {
        return selector.select(database, memory);
    }

    @Bean
    @Primary
    public InventoryRepository inventoryRepository(StorageBackendSelector selector,
                                                   MySQLInventoryRepository database, InMemoryInventoryRepository memory) {
        return selector.select(database, memory);
    }

    @Bean
    @Primary
    public StockDeductionBacklogRepository stockDeductionBacklogRepository(
            StorageBackendSelector selector,
            MySQLStockDeductionBacklogRepository database, InMemoryStockDeductionBacklogRepository memory) {
        return selector.select(database, memory);
    }

    @Bean
    @Primary
    public ShiftRepository shiftRepository(StorageBackendSelector selector,
                                           MySQLShiftRepository database, InMemoryShiftRepository memory) {
        return selector.select(database, memory);
    }

    @Bean
    @Primary
    public CashMovementRepository cashMovementRepository(StorageBackendSelector selector,
                                                         MySQLCashMovementRepository database,
                                                         InMemoryCashMovementRepository memory) {
        return selector.select(database, memory);
    }

    @Bean
    @Primary
    public ExpenseRepository expenseRepository(StorageBackendSelector selector,
                                               MySQLExpenseRepository database, InMemoryExpenseRepository memory) {
        return selector.select(database, memory);
    }

    @Bean
    @Primary
    public RefundRepository refundRepository(StorageBackendSelector selector,
                                             MySQLRefundRepository database, InMemoryRefundRepository memory) {
        return selector.select(database, memory);
    }

    @Bean
    @Primary
    public DeletionRequestRepository deletionRequestRepository(StorageBackendSelector selector,
                                                               MySQLDeletionRequestRepository database,
                                                               InMemoryDeletionRequestRepository memory) {
        return selector.select(database, memory);
    }

    @Bean
    @Primary
    public DeletionLogRepository deletionLogRepository(StorageBackendSelector selector,
                                                       MySQLDeletionLogRepository database,
                                                       InMemoryDeletionLogRepository memory) {
        return selector.select(database, memory);
    }

    @Bean
    @Primary
    public DailyReportRepository dailyReportRepository(StorageBackendSelector selector,
                                                       MySQLDailyReportRepository database,
                                                       InMemoryDailyReportRepository memory) {
        return selector.select(database, memory);
    }
}
