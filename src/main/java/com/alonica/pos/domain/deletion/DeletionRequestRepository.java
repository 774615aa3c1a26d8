package com.alonica.pos.domain.deletion;

import java.util.List;
import java.util.Optional;

/**
 * 삭제 요청 영속성 Port
 */
public interface DeletionRequestRepository {

    DeletionRequest save(DeletionRequest request);

    Optional<DeletionRequest> findById(Long requestId);

    /**
     * 승인/거절 결정을 위한 조회 (DB 구현은 행 잠금)
     */
    Optional<DeletionRequest> findByIdForUpdate(Long requestId);

    /**
     * status가 null이면 전체 (최신순)
     */
    List<DeletionRequest> findByStatus(DeletionRequestStatus status);
}
