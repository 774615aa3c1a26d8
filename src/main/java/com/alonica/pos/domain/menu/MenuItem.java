package com.alonica.pos.domain.menu;

import jakarta.persistence.*;
import lombok.*;

/**
 * MenuItem - 메뉴 읽기 모델
 *
 * 메뉴/카테고리 관리는 외부 협력자 책임이며, 주문 코어는 가격과 판매 가능 여부만 읽는다.
 */
@Entity
@Table(name = "menu_items")
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MenuItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "menu_item_id")
    private Long menuItemId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "price", nullable = false)
    private Long price;

    @Column(name = "is_available", nullable = false)
    private boolean available;
}
