package com.alonica.pos.domain.menu;

import java.util.List;

/**
 * 레시피 조회 Port
 * 주문 코어는 조회만 사용하고, save는 초기 데이터 적재용
 */
public interface RecipeRepository {

    List<MenuItemIngredient> findByMenuItemId(Long menuItemId);

    MenuItemIngredient save(MenuItemIngredient ingredient);
}
