package com.alonica.pos.domain.inventory;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * InventoryItem - 재료 재고 엔티티
 *
 * 핵심 비즈니스 규칙:
 * - 재고 차감이 성공한 뒤 currentStock은 음수가 될 수 없음
 * - currentStock <= minStock 이면 재고 부족(low stock) 상태
 */
@Entity
@Table(name = "inventory_items")
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class InventoryItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "inventory_item_id")
    private Long inventoryItemId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "category")
    private String category;

    @Column(name = "current_stock", nullable = false, precision = 12, scale = 3)
    private BigDecimal currentStock;

    @Column(name = "min_stock", nullable = false, precision = 12, scale = 3)
    private BigDecimal minStock;

    @Column(name = "max_stock", precision = 12, scale = 3)
    private BigDecimal maxStock;

    @Column(name = "unit", nullable = false)
    private String unit;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean hasEnough(BigDecimal required) {
        return currentStock.compareTo(required) >= 0;
    }

    public boolean isLowStock() {
        return currentStock.compareTo(minStock) <= 0;
    }

    /**
     * 재고 차감
     *
     * @throws IllegalStateException 차감 후 재고가 음수가 되는 경우
     */
    public void deduct(BigDecimal quantity) {
        if (quantity.signum() <= 0) {
            throw new IllegalArgumentException("차감 수량은 0보다 커야 합니다");
        }
        if (!hasEnough(quantity)) {
            throw new IllegalStateException("재고가 부족합니다. 재료: " + name
                    + ", 현재 재고: " + currentStock + ", 요청 수량: " + quantity);
        }
        this.currentStock = this.currentStock.subtract(quantity);
        this.updatedAt = LocalDateTime.now();
    }
}
