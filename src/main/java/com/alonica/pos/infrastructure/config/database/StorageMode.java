package com.alonica.pos.infrastructure.config.database;

/**
 * 저장소 선택 모드 (pos.storage.mode)
 * - AUTO: 첫 사용 시 DB 연결을 한 번 확인하여 결정
 * - DATABASE: 항상 MySQL
 * - MEMORY: 항상 인메모리
 */
public enum StorageMode {
    AUTO,
    DATABASE,
    MEMORY;

    public static StorageMode fromString(String mode) {
        try {
            return StorageMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("유효하지 않은 저장소 모드입니다: " + mode);
        }
    }
}
