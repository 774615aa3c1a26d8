package com.alonica.pos.infrastructure.persistence.deletion;

import com.alonica.pos.domain.deletion.DeletionLog;
import com.alonica.pos.domain.deletion.DeletionLogRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * MySQL 기반 삭제 감사 로그 Repository 구현
 */
@Repository
public class MySQLDeletionLogRepository implements DeletionLogRepository {

    private final DeletionLogJpaRepository deletionLogJpaRepository;

    public MySQLDeletionLogRepository(DeletionLogJpaRepository deletionLogJpaRepository) {
        this.deletionLogJpaRepository = deletionLogJpaRepository;
    }

    @Override
    public DeletionLog save(DeletionLog log) {
        return deletionLogJpaRepository.save(log);
    }

    @Override
    public List<DeletionLog> findAll() {
        return deletionLogJpaRepository.findAllByOrderByCreatedAtDesc();
    }
}
