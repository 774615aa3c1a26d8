package com.alonica.pos.infrastructure.persistence.deletion;

import com.alonica.pos.domain.deletion.DeletionLog;
import com.alonica.pos.domain.deletion.DeletionLogRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * InMemoryDeletionLogRepository - 삭제 감사 로그 구현체 (인메모리)
 */
@Repository
public class InMemoryDeletionLogRepository implements DeletionLogRepository {

    private final ConcurrentHashMap<Long, DeletionLog> logs = new ConcurrentHashMap<>();
    private long logIdSequence = 0L;

    @Override
    public synchronized DeletionLog save(DeletionLog log) {
        DeletionLog saved = log.getLogId() == null
                ? log.toBuilder().logId(++logIdSequence).build()
                : log;
        logs.put(saved.getLogId(), saved);
        return saved;
    }

    @Override
    public List<DeletionLog> findAll() {
        return logs.values().stream()
                .sorted(Comparator.comparing(DeletionLog::getLogId).reversed())
                .collect(Collectors.toList());
    }
}
