package com.alonica.pos.domain.menu;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * MenuItemIngredient - 레시피 한 줄 (메뉴 1개당 필요한 재료량)
 */
@Entity
@Table(name = "menu_item_ingredients",
        indexes = @Index(name = "idx_ingredient_menu_item", columnList = "menu_item_id"))
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MenuItemIngredient {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "ingredient_id")
    private Long ingredientId;

    @Column(name = "menu_item_id", nullable = false)
    private Long menuItemId;

    @Column(name = "inventory_item_id", nullable = false)
    private Long inventoryItemId;

    @Column(name = "quantity_needed", nullable = false, precision = 12, scale = 3)
    private BigDecimal quantityNeeded;
}
