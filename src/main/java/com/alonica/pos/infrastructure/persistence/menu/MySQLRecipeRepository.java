package com.alonica.pos.infrastructure.persistence.menu;

import com.alonica.pos.domain.menu.MenuItemIngredient;
import com.alonica.pos.domain.menu.RecipeRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * MySQL 기반 레시피 Repository 구현
 */
@Repository
public class MySQLRecipeRepository implements RecipeRepository {

    private final MenuItemIngredientJpaRepository ingredientJpaRepository;

    public MySQLRecipeRepository(MenuItemIngredientJpaRepository ingredientJpaRepository) {
        this.ingredientJpaRepository = ingredientJpaRepository;
    }

    @Override
    public List<MenuItemIngredient> findByMenuItemId(Long menuItemId) {
        return ingredientJpaRepository.findByMenuItemId(menuItemId);
    }

    @Override
    public MenuItemIngredient save(MenuItemIngredient ingredient) {
        return ingredientJpaRepository.save(ingredient);
    }
}
