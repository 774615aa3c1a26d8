package com.alonica.pos.infrastructure.persistence.inventory;

import com.alonica.pos.domain.inventory.InventoryItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * InventoryItem JPA Repository
 */
public interface InventoryItemJpaRepository extends JpaRepository<InventoryItem, Long> {

    /**
     * 조건부 원자적 차감
     * UPDATE ... SET current_stock = current_stock - n WHERE id = ? AND current_stock >= n
     *
     * 읽고-계산하고-쓰는 대신 DB 한 문장으로 차감하므로 동시 차감에서도 음수가 되지 않는다.
     *
     * @return 갱신된 행 수 (0이면 재고 부족)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE InventoryItem i SET i.currentStock = i.currentStock - :quantity, i.updatedAt = :now " +
           "WHERE i.inventoryItemId = :inventoryItemId AND i.currentStock >= :quantity")
    int deductIfAvailable(@Param("inventoryItemId") Long inventoryItemId,
                          @Param("quantity") BigDecimal quantity,
                          @Param("now") LocalDateTime now);

    @Query("SELECT i FROM InventoryItem i WHERE i.currentStock <= i.minStock ORDER BY i.name ASC")
    List<InventoryItem> findLowStock();
}
