package com.alonica.pos.infrastructure.persistence.deletion;

import com.alonica.pos.domain.deletion.DeletionRequest;
import com.alonica.pos.domain.deletion.DeletionRequestStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * DeletionRequest JPA Repository
 */
public interface DeletionRequestJpaRepository extends JpaRepository<DeletionRequest, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM DeletionRequest r WHERE r.requestId = :requestId")
    Optional<DeletionRequest> findByIdForUpdate(@Param("requestId") Long requestId);

    List<DeletionRequest> findByStatusOrderByCreatedAtDesc(DeletionRequestStatus status);

    List<DeletionRequest> findAllByOrderByCreatedAtDesc();
}
