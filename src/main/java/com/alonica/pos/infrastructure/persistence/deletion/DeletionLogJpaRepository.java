package com.alonica.pos.infrastructure.persistence.deletion;

import com.alonica.pos.domain.deletion.DeletionLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * DeletionLog JPA Repository
 */
public interface DeletionLogJpaRepository extends JpaRepository<DeletionLog, Long> {

    List<DeletionLog> findAllByOrderByCreatedAtDesc();
}
