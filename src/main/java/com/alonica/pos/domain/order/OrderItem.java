package com.alonica.pos.domain.order;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * OrderItem - 주문 항목 값 객체 (Embeddable)
 *
 * 책임:
 * - 주문 시점의 메뉴 이름/단가 스냅샷 보존
 * - 항목별 소계 계산
 *
 * 핵심 비즈니스 규칙:
 * - 소계 = 단가 × 수량
 * - 수량은 1 이상이어야 함
 * - 단가는 0 이상이어야 함
 * - 주문 내 위치(0부터 시작하는 인덱스)가 삭제 요청의 식별자가 됨
 */
@Embeddable
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class OrderItem {

    @Column(name = "menu_item_id", nullable = false)
    private Long menuItemId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "unit_price", nullable = false)
    private Long unitPrice;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "notes")
    private String notes;

    /**
     * OrderItem 생성 팩토리 메서드
     *
     * @param menuItemId 메뉴 ID
     * @param name 주문 시점의 메뉴명 (스냅샷)
     * @param unitPrice 주문 시점의 단가 (스냅샷)
     * @param quantity 수량
     * @param notes 요청 사항 (선택)
     */
    public static OrderItem createOrderItem(Long menuItemId, String name, Long unitPrice,
                                            Integer quantity, String notes) {
        if (menuItemId == null) {
            throw new IllegalArgumentException("메뉴 ID는 필수입니다");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("메뉴명은 필수입니다");
        }
        if (unitPrice == null || unitPrice < 0) {
            throw new IllegalArgumentException("단가는 0 이상이어야 합니다");
        }
        if (quantity == null || quantity < 1) {
            throw new IllegalArgumentException("수량은 1 이상이어야 합니다");
        }
        return OrderItem.builder()
                .menuItemId(menuItemId)
                .name(name)
                .unitPrice(unitPrice)
                .quantity(quantity)
                .notes(notes)
                .build();
    }

    public long getLineTotal() {
        return unitPrice * quantity;
    }

    /**
     * 같은 메뉴를 같은 수량으로 담은 항목인지 비교 (삭제 승인 시 대상 확인용)
     */
    public boolean isSameLineAs(OrderItem other) {
        return other != null
                && menuItemId.equals(other.menuItemId)
                && quantity.equals(other.quantity);
    }
}
