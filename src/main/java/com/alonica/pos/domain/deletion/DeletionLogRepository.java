package com.alonica.pos.domain.deletion;

import java.util.List;

/**
 * 삭제 감사 로그 영속성 Port (추가 전용)
 */
public interface DeletionLogRepository {

    DeletionLog save(DeletionLog log);

    List<DeletionLog> findAll();
}
