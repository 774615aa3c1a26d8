package com.alonica.pos.domain.inventory;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * 재고 부족 항목 (재료별 필요량과 현재 재고)
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class StockShortage {

    private final Long inventoryItemId;

    private final String name;

    private final BigDecimal required;

    private final BigDecimal available;
}
