package com.alonica.pos.infrastructure.config.database;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("StorageBackendSelector 테스트")
class StorageBackendSelectorTest {

    @Mock
    private DataSource dataSource;

    @Mock
    private Connection connection;

    @Test
    @DisplayName("memory 모드 - DB 연결을 확인하지 않고 인메모리 선택")
    void testMemoryMode() throws SQLException {
        // Given
        StorageBackendSelector selector = new StorageBackendSelector(dataSource, "memory");

        // When & Then
        assertEquals("mem", selector.select("db", "mem"));
        verify(dataSource, never()).getConnection();
    }

    @Test
    @DisplayName("database 모드 - 항상 DB 선택")
    void testDatabaseMode() throws SQLException {
        // Given
        StorageBackendSelector selector = new StorageBackendSelector(dataSource, "DATABASE");

        // When & Then
        assertTrue(selector.isDatabaseSelected());
        verify(dataSource, never()).getConnection();
    }

    @Test
    @DisplayName("auto 모드 - 연결이 유효하면 DB 선택")
    void testAutoMode_DatabaseAvailable() throws SQLException {
        // Given
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(anyInt())).thenReturn(true);
        StorageBackendSelector selector = new StorageBackendSelector(dataSource, "auto");

        // When & Then
        assertEquals("db", selector.select("db", "mem"));
        verify(connection).close();
    }

    @Test
    @DisplayName("auto 모드 - 연결 실패 시 인메모리로 대체")
    void testAutoMode_DatabaseUnavailable() throws SQLException {
        // Given
        when(dataSource.getConnection()).thenThrow(new SQLException("Communications link failure"));
        StorageBackendSelector selector = new StorageBackendSelector(dataSource, "auto");

        // When & Then
        assertFalse(selector.isDatabaseSelected());
    }

    @Test
    @DisplayName("auto 모드 - 결정은 한 번만 내리고 캐시")
    void testAutoMode_DecisionCached() throws SQLException {
        // Given
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(anyInt())).thenReturn(false);
        StorageBackendSelector selector = new StorageBackendSelector(dataSource, " Auto ");

        // When
        selector.isDatabaseSelected();
        selector.select("db", "mem");
        boolean selected = selector.isDatabaseSelected();

        // Then
        assertFalse(selected);
        verify(dataSource, times(1)).getConnection();
    }

    @Test
    @DisplayName("유효하지 않은 모드는 생성 시 예외")
    void testInvalidMode() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
                () -> new StorageBackendSelector(dataSource, "redis"));
        assertThrows(IllegalArgumentException.class,
                () -> new StorageBackendSelector(dataSource, null));
    }
}
