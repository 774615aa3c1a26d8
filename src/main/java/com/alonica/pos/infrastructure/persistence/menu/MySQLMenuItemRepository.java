package com.alonica.pos.infrastructure.persistence.menu;

import com.alonica.pos.domain.menu.MenuItem;
import com.alonica.pos.domain.menu.MenuItemRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * MySQL 기반 MenuItem Repository 구현
 */
@Repository
public class MySQLMenuItemRepository implements MenuItemRepository {

    private final MenuItemJpaRepository menuItemJpaRepository;

    public MySQLMenuItemRepository(MenuItemJpaRepository menuItemJpaRepository) {
        this.menuItemJpaRepository = menuItemJpaRepository;
    }

    @Override
    public Optional<MenuItem> findById(Long menuItemId) {
        return menuItemJpaRepository.findById(menuItemId);
    }

    @Override
    public MenuItem save(MenuItem menuItem) {
        return menuItemJpaRepository.save(menuItem);
    }
}
