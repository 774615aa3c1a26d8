package com.alonica.pos.infrastructure.config.database;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * StorageBackendSelector - DB/인메모리 저장소 선택기
 *
 * 역할:
 * - pos.storage.mode에 따라 각 Port의 구현체를 고른다
 * - AUTO 모드에서는 최초 호출 시 DB 연결을 한 번만 확인하고 결과를 캐시
 * - 이후 모든 Port가 같은 결정을 공유하므로 요청 도중 저장소가 바뀌지 않는다
 * - 연결 확인은 지연 프록시가 아닌 실제 커넥션 풀로 수행
 */
@Slf4j
@Component
public class StorageBackendSelector {

    private static final int VALIDATION_TIMEOUT_SECONDS = 3;

    private final DataSource dataSource;
    private final StorageMode mode;
    private volatile Boolean databaseSelected;

    public StorageBackendSelector(@Qualifier("targetDataSource") DataSource dataSource,
                                  @Value("${pos.storage.mode:auto}") String mode) {
        this.dataSource = dataSource;
        this.mode = StorageMode.fromString(mode);
    }

    /**
     * DB 구현체와 인메모리 구현체 중 선택
     */
    public <T> T select(T database, T memory) {
        return isDatabaseSelected() ? database : memory;
    }

    public boolean isDatabaseSelected() {
        Boolean selected = databaseSelected;
        if (selected == null) {
            synchronized (this) {
                selected = databaseSelected;
                if (selected == null) {
                    selected = decide();
                    databaseSelected = selected;
                }
            }
        }
        return selected;
    }

    private boolean decide() {
        switch (mode) {
            case DATABASE:
                log.info("[StorageBackendSelector] 저장소 모드: DATABASE (설정)");
                return true;
            case MEMORY:
                log.info("[StorageBackendSelector] 저장소 모드: MEMORY (설정)");
                return false;
            default:
                boolean available = probeDatabase();
                if (available) {
                    log.info("[StorageBackendSelector] DB 연결 확인 완료 - MySQL 저장소 사용");
                } else {
                    log.warn("[StorageBackendSelector] DB 연결 불가 - 인메모리 저장소로 대체합니다 (재시작 전까지 유지)");
                }
                return available;
        }
    }

    private boolean probeDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException | RuntimeException e) {
            log.warn("[StorageBackendSelector] DB 연결 확인 실패: {}", e.getMessage());
            return false;
        }
    }
}
