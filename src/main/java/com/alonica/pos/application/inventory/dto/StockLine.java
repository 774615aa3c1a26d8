package com.alonica.pos.application.inventory.dto;

import com.alonica.pos.domain.order.OrderItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 재고 계산 입력 한 줄 (메뉴 ID, 수량)
 */
@Getter
@Builder
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class StockLine {
    private Long menuItemId;
    private int quantity;

    public static List<StockLine> fromOrderItems(List<OrderItem> items) {
        return items.stream()
                .map(item -> new StockLine(item.getMenuItemId(), item.getQuantity()))
                .collect(Collectors.toList());
    }

    /**
     * 백로그 저장용 직렬화: "menuItemId:quantity,menuItemId:quantity"
     */
    public static String toSnapshot(List<StockLine> lines) {
        return lines.stream()
                .map(line -> line.getMenuItemId() + ":" + line.getQuantity())
                .collect(Collectors.joining(","));
    }

    public static List<StockLine> fromSnapshot(String snapshot) {
        List<StockLine> lines = new ArrayList<>();
        if (snapshot == null || snapshot.isBlank()) {
            return lines;
        }
        for (String token : snapshot.split(",")) {
            String[] parts = token.trim().split(":");
            if (parts.length != 2) {
                throw new IllegalArgumentException("잘못된 스냅샷 형식입니다: " + token);
            }
            lines.add(new StockLine(Long.parseLong(parts[0]), Integer.parseInt(parts[1])));
        }
        return lines;
    }
}
