package com.alonica.pos.infrastructure.persistence.deletion;

import com.alonica.pos.domain.deletion.DeletionRequest;
import com.alonica.pos.domain.deletion.DeletionRequestRepository;
import com.alonica.pos.domain.deletion.DeletionRequestStatus;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 삭제 요청 Repository 구현
 */
@Repository
public class MySQLDeletionRequestRepository implements DeletionRequestRepository {

    private final DeletionRequestJpaRepository deletionRequestJpaRepository;

    public MySQLDeletionRequestRepository(DeletionRequestJpaRepository deletionRequestJpaRepository) {
        this.deletionRequestJpaRepository = deletionRequestJpaRepository;
    }

    @Override
    public DeletionRequest save(DeletionRequest request) {
        return deletionRequestJpaRepository.save(request);
    }

    @Override
    public Optional<DeletionRequest> findById(Long requestId) {
        return deletionRequestJpaRepository.findById(requestId);
    }

    @Override
    public Optional<DeletionRequest> findByIdForUpdate(Long requestId) {
        return deletionRequestJpaRepository.findByIdForUpdate(requestId);
    }

    @Override
    public List<DeletionRequest> findByStatus(DeletionRequestStatus status) {
        if (status == null) {
            return deletionRequestJpaRepository.findAllByOrderByCreatedAtDesc();
        }
        return deletionRequestJpaRepository.findByStatusOrderByCreatedAtDesc(status);
    }
}
