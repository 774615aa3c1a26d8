package com.alonica.pos.infrastructure.persistence.deletion;

import com.alonica.pos.domain.deletion.DeletionRequest;
import com.alonica.pos.domain.deletion.DeletionRequestRepository;
import com.alonica.pos.domain.deletion.DeletionRequestStatus;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * InMemoryDeletionRequestRepository - 삭제 요청 구현체 (인메모리)
 */
@Repository
public class InMemoryDeletionRequestRepository implements DeletionRequestRepository {

    private final ConcurrentHashMap<Long, DeletionRequest> requests = new ConcurrentHashMap<>();
    private long requestIdSequence = 0L;

    @Override
    public synchronized DeletionRequest save(DeletionRequest request) {
        DeletionRequest saved = request.getRequestId() == null
                ? request.toBuilder().requestId(++requestIdSequence).build()
                : request;
        requests.put(saved.getRequestId(), saved);
        return saved;
    }

    @Override
    public Optional<DeletionRequest> findById(Long requestId) {
        return Optional.ofNullable(requests.get(requestId));
    }

    @Override
    public Optional<DeletionRequest> findByIdForUpdate(Long requestId) {
        return findById(requestId);
    }

    @Override
    public List<DeletionRequest> findByStatus(DeletionRequestStatus status) {
        return requests.values().stream()
                .filter(request -> status == null || request.getStatus() == status)
                .sorted(Comparator.comparing(DeletionRequest::getRequestId).reversed())
                .collect(Collectors.toList());
    }
}
