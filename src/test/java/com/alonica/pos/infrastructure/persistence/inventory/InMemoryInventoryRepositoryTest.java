package com.alonica.pos.infrastructure.persistence.inventory;

import com.alonica.pos.domain.inventory.InventoryItem;
import com.alonica.pos.domain.inventory.StockDeductionConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryInventoryRepository 테스트")
class InMemoryInventoryRepositoryTest {

    private InMemoryInventoryRepository inventoryRepository;

    @BeforeEach
    void setUp() {
        inventoryRepository = new InMemoryInventoryRepository();
    }

    private InventoryItem save(String name, String stock, String minStock) {
        return inventoryRepository.save(InventoryItem.builder()
                .name(name)
                .currentStock(new BigDecimal(stock))
                .minStock(new BigDecimal(minStock))
                .unit("pcs")
                .build());
    }

    @Test
    @DisplayName("deductAll - 한 재료라도 부족하면 어떤 재료도 차감하지 않음")
    void testDeductAll_Conflict() {
        // Given
        InventoryItem enough = save("Gula", "10", "1");
        InventoryItem scarce = save("Susu", "1", "1");
        Map<Long, BigDecimal> requirements = new LinkedHashMap<>();
        requirements.put(enough.getInventoryItemId(), new BigDecimal("3"));
        requirements.put(scarce.getInventoryItemId(), new BigDecimal("2"));

        // When
        StockDeductionConflictException e = assertThrows(StockDeductionConflictException.class,
                () -> inventoryRepository.deductAll(requirements));

        // Then
        assertEquals(scarce.getInventoryItemId(), e.getInventoryItemId());
        assertEquals(0, new BigDecimal("10").compareTo(
                inventoryRepository.findById(enough.getInventoryItemId()).orElseThrow().getCurrentStock()));
    }

    @Test
    @DisplayName("findLowStock - currentStock <= minStock 인 재료만")
    void testFindLowStock() {
        // Given
        save("Gula", "10", "2");
        save("Susu", "2", "2");
        save("Kopi", "1", "5");

        // When & Then
        assertEquals(2, inventoryRepository.findLowStock().size());
    }

    @Test
    @DisplayName("동시 차감 - 재고 10개에 20개 요청이 1개씩 차감하면 정확히 10건만 성공")
    void testDeductAll_Concurrent() throws InterruptedException {
        // Given
        InventoryItem item = save("Telur", "10", "0");
        int threadCount = 20;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch latch = new CountDownLatch(threadCount);
        AtomicInteger success = new AtomicInteger();
        AtomicInteger conflict = new AtomicInteger();

        // When
        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    inventoryRepository.deductAll(Map.of(item.getInventoryItemId(), BigDecimal.ONE));
                    success.incrementAndGet();
                } catch (StockDeductionConflictException e) {
                    conflict.incrementAndGet();
                } finally {
                    latch.countDown();
                }
            });
        }
        latch.await(10, TimeUnit.SECONDS);
        executor.shutdown();

        // Then
        assertEquals(10, success.get());
        assertEquals(10, conflict.get());
        assertEquals(0, BigDecimal.ZERO.compareTo(
                inventoryRepository.findById(item.getInventoryItemId()).orElseThrow().getCurrentStock()));
    }
}
