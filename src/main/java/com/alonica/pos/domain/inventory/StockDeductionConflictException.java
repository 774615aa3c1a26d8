package com.alonica.pos.domain.inventory;

import com.alonica.pos.common.exception.DomainException;
import com.alonica.pos.common.exception.ErrorCode;

/**
 * 조건부 재고 차감이 0건을 갱신한 경우 (검증 이후 경쟁 요청이 재고를 소진)
 */
public class StockDeductionConflictException extends DomainException {

    private final Long inventoryItemId;

    public StockDeductionConflictException(Long inventoryItemId) {
        super(ErrorCode.INSUFFICIENT_STOCK, "조건부 차감 실패 inventoryItemId=" + inventoryItemId);
        this.inventoryItemId = inventoryItemId;
    }

    public Long getInventoryItemId() {
        return inventoryItemId;
    }
}
