package com.alonica.pos.infrastructure.persistence.menu;

import com.alonica.pos.domain.menu.MenuItemIngredient;
import com.alonica.pos.domain.menu.RecipeRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * InMemoryRecipeRepository - 레시피 저장소 구현체 (인메모리)
 */
@Repository
public class InMemoryRecipeRepository implements RecipeRepository {

    private final ConcurrentHashMap<Long, MenuItemIngredient> ingredients = new ConcurrentHashMap<>();
    private long ingredientIdSequence = 0L;

    @Override
    public List<MenuItemIngredient> findByMenuItemId(Long menuItemId) {
        return ingredients.values().stream()
                .filter(ingredient -> ingredient.getMenuItemId().equals(menuItemId))
                .collect(Collectors.toList());
    }

    @Override
    public MenuItemIngredient save(MenuItemIngredient ingredient) {
        if (ingredient.getIngredientId() == null) {
            synchronized (this) {
                MenuItemIngredient saved = ingredient.toBuilder().ingredientId(++ingredientIdSequence).build();
                ingredients.put(saved.getIngredientId(), saved);
                return saved;
            }
        }
        ingredients.put(ingredient.getIngredientId(), ingredient);
        return ingredient;
    }
}
