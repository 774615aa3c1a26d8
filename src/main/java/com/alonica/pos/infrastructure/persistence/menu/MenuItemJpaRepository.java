package com.alonica.pos.infrastructure.persistence.menu;

import com.alonica.pos.domain.menu.MenuItem;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * MenuItem JPA Repository
 */
public interface MenuItemJpaRepository extends JpaRepository<MenuItem, Long> {
}
