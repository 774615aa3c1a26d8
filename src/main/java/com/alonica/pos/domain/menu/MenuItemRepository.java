package com.alonica.pos.domain.menu;

import java.util.Optional;

/**
 * 메뉴 조회 Port
 * 주문 코어는 조회만 사용하고, save는 초기 데이터 적재용
 */
public interface MenuItemRepository {

    Optional<MenuItem> findById(Long menuItemId);

    MenuItem save(MenuItem menuItem);
}
