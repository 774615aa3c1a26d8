package com.alonica.pos.infrastructure.persistence.menu;

import com.alonica.pos.domain.menu.MenuItemIngredient;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * MenuItemIngredient JPA Repository
 */
public interface MenuItemIngredientJpaRepository extends JpaRepository<MenuItemIngredient, Long> {

    List<MenuItemIngredient> findByMenuItemId(Long menuItemId);
}
