package com.alonica.pos.infrastructure.persistence.menu;

import com.alonica.pos.domain.menu.MenuItem;
import com.alonica.pos.domain.menu.MenuItemRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * InMemoryMenuItemRepository - 메뉴 저장소 구현체 (인메모리)
 */
@Repository
public class InMemoryMenuItemRepository implements MenuItemRepository {

    private final ConcurrentHashMap<Long, MenuItem> menuItems = new ConcurrentHashMap<>();
    private long menuItemIdSequence = 0L;

    @Override
    public Optional<MenuItem> findById(Long menuItemId) {
        return Optional.ofNullable(menuItems.get(menuItemId));
    }

    @Override
    public MenuItem save(MenuItem menuItem) {
        if (menuItem.getMenuItemId() == null) {
            synchronized (this) {
                MenuItem saved = menuItem.toBuilder().menuItemId(++menuItemIdSequence).build();
                menuItems.put(saved.getMenuItemId(), saved);
                return saved;
            }
        }
        menuItems.put(menuItem.getMenuItemId(), menuItem);
        return menuItem;
    }
}
