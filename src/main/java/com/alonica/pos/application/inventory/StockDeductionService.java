package com.alonica.pos.application.inventory;

import com.alonica.pos.application.inventory.dto.StockDeductionResult;
import com.alonica.pos.application.inventory.dto.StockLine;
import com.alonica.pos.domain.inventory.InventoryItem;
import com.alonica.pos.domain.inventory.InventoryRepository;
import com.alonica.pos.domain.inventory.StockDeductionConflictException;
import com.alonica.pos.domain.inventory.StockShortage;
import com.alonica.pos.domain.menu.MenuItemIngredient;
import com.alonica.pos.domain.menu.RecipeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * StockDeductionService - 주문 항목 → 재료 차감 엔진
 *
 * 처리 순서:
 * 1. 레시피로 재료별 필요량 계산 (quantityNeeded × 수량), 같은 재료는 합산
 * 2. 현재 재고와 비교하여 부족 목록 생성 (재고 항목이 없는 레시피 줄은 건너뜀)
 * 3. 부족이 없을 때만 InventoryRepository.deductAll로 일괄 차감
 *
 * 이 서비스는 트랜잭션을 열지 않는다.
 * deductAll이 자체 트랜잭션에서 조건부 차감을 수행하고, 경합으로 실패하면 전부 롤백된다.
 * 여기서 트랜잭션을 열면 경합 예외를 잡은 뒤 바깥 트랜잭션이 rollback-only로 남는다.
 */
@Service
public class StockDeductionService {

    private static final Logger log = LoggerFactory.getLogger(StockDeductionService.class);

    private final RecipeRepository recipeRepository;
    private final InventoryRepository inventoryRepository;

    public StockDeductionService(RecipeRepository recipeRepository,
                                 InventoryRepository inventoryRepository) {
        this.recipeRepository = recipeRepository;
        this.inventoryRepository = inventoryRepository;
    }

    /**
     * 재고 검증만 수행 (차감하지 않음)
     */
    public StockDeductionResult validate(List<StockLine> lines) {
        Requirements requirements = computeRequirements(lines);
        List<StockShortage> shortages = requirements.findShortages();
        return StockDeductionResult.builder()
                .success(shortages.isEmpty())
                .insufficientStock(shortages)
                .deductions(List.of())
                .build();
    }

    /**
     * 검증 후 일괄 차감 (전부 성공 또는 전부 실패)
     */
    public StockDeductionResult deduct(List<StockLine> lines) {
        Requirements requirements = computeRequirements(lines);
        List<StockShortage> shortages = requirements.findShortages();
        if (!shortages.isEmpty()) {
            log.info("[StockDeductionService] 재고 부족으로 차감 중단 - shortages={}", shortages.size());
            return StockDeductionResult.failed(shortages);
        }
        if (requirements.amounts.isEmpty()) {
            return StockDeductionResult.builder()
                    .success(true)
                    .insufficientStock(List.of())
                    .deductions(List.of())
                    .build();
        }

        try {
            inventoryRepository.deductAll(requirements.amounts);
        } catch (StockDeductionConflictException e) {
            // 검증 이후 다른 요청이 재고를 먼저 소진함: 최신 재고로 부족 목록을 다시 만든다
            log.warn("[StockDeductionService] 조건부 차감 경합으로 전체 롤백 - inventoryItemId={}",
                    e.getInventoryItemId());
            List<StockShortage> latest = computeRequirements(lines).findShortages();
            if (latest.isEmpty()) {
                InventoryItem item = requirements.items.get(e.getInventoryItemId());
                latest = List.of(new StockShortage(e.getInventoryItemId(),
                        item != null ? item.getName() : String.valueOf(e.getInventoryItemId()),
                        requirements.amounts.get(e.getInventoryItemId()),
                        item != null ? item.getCurrentStock() : BigDecimal.ZERO));
            }
            return StockDeductionResult.failed(latest);
        }

        List<StockDeductionResult.Deduction> deductions = buildDeductions(requirements);
        log.info("[StockDeductionService] 재고 차감 완료 - 재료 {}건", deductions.size());
        return StockDeductionResult.builder()
                .success(true)
                .insufficientStock(List.of())
                .deductions(deductions)
                .build();
    }

    private List<StockDeductionResult.Deduction> buildDeductions(Requirements requirements) {
        Map<Long, InventoryItem> after = inventoryRepository.findAllByIds(requirements.amounts.keySet()).stream()
                .collect(Collectors.toMap(InventoryItem::getInventoryItemId, Function.identity()));
        List<StockDeductionResult.Deduction> deductions = new ArrayList<>();
        requirements.amounts.forEach((inventoryItemId, amount) -> {
            InventoryItem before = requirements.items.get(inventoryItemId);
            InventoryItem updated = after.get(inventoryItemId);
            deductions.add(StockDeductionResult.Deduction.builder()
                    .inventoryItemId(inventoryItemId)
                    .name(before.getName())
                    .deducted(amount)
                    .newStock(updated != null
                            ? updated.getCurrentStock()
                            : before.getCurrentStock().subtract(amount))
                    .build());
        });
        return deductions;
    }

    /**
     * 재료별 필요량 합산
     */
    private Requirements computeRequirements(List<StockLine> lines) {
        Map<Long, BigDecimal> amounts = new LinkedHashMap<>();
        for (StockLine line : lines) {
            if (line.getQuantity() <= 0) {
                throw new IllegalArgumentException("수량은 1 이상이어야 합니다: menuItemId=" + line.getMenuItemId());
            }
            BigDecimal quantity = BigDecimal.valueOf(line.getQuantity());
            for (MenuItemIngredient ingredient : recipeRepository.findByMenuItemId(line.getMenuItemId())) {
                BigDecimal required = ingredient.getQuantityNeeded().multiply(quantity);
                amounts.merge(ingredient.getInventoryItemId(), required, BigDecimal::add);
            }
        }

        Map<Long, InventoryItem> items = inventoryRepository.findAllByIds(amounts.keySet()).stream()
                .collect(Collectors.toMap(InventoryItem::getInventoryItemId, Function.identity()));

        // 재고 항목이 없는 레시피 줄은 차감 대상에서 제외
        amounts.keySet().removeIf(inventoryItemId -> {
            boolean missing = !items.containsKey(inventoryItemId);
            if (missing) {
                log.warn("[StockDeductionService] 재고에 등록되지 않은 재료를 참조 - inventoryItemId={}",
                        inventoryItemId);
            }
            return missing;
        });
        return new Requirements(amounts, items);
    }

    private static final class Requirements {
        private final Map<Long, BigDecimal> amounts;
        private final Map<Long, InventoryItem> items;

        private Requirements(Map<Long, BigDecimal> amounts, Map<Long, InventoryItem> items) {
            this.amounts = amounts;
            this.items = items;
        }

        private List<StockShortage> findShortages() {
            List<StockShortage> shortages = new ArrayList<>();
            amounts.forEach((inventoryItemId, required) -> {
                InventoryItem item = items.get(inventoryItemId);
                if (!item.hasEnough(required)) {
                    shortages.add(new StockShortage(inventoryItemId, item.getName(), required,
                            item.getCurrentStock()));
                }
            });
            return shortages;
        }
    }
}
