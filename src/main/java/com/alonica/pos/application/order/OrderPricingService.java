package com.alonica.pos.application.order;

import com.alonica.pos.application.order.dto.OrderLineCommand;
import com.alonica.pos.domain.menu.MenuItem;
import com.alonica.pos.domain.menu.MenuItemRepository;
import com.alonica.pos.domain.menu.MenuItemUnavailableException;
import com.alonica.pos.domain.order.InvalidOrderItemsException;
import com.alonica.pos.domain.order.OrderItem;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderPricingService - 주문 항목 가격 책정
 *
 * 클라이언트가 보낸 가격은 사용하지 않고 메뉴 읽기 모델의 현재 가격으로 항목을 만든다.
 * 존재하지 않거나 판매 중지된 메뉴는 MenuItemUnavailableException.
 */
@Component
public class OrderPricingService {

    private final MenuItemRepository menuItemRepository;

    public OrderPricingService(MenuItemRepository menuItemRepository) {
        this.menuItemRepository = menuItemRepository;
    }

    public List<OrderItem> price(List<OrderLineCommand> lines) {
        if (lines == null || lines.isEmpty()) {
            throw new InvalidOrderItemsException("주문 항목이 최소 1개 이상 필요합니다");
        }
        return lines.stream()
                .map(this::priceLine)
                .collect(Collectors.toList());
    }

    private OrderItem priceLine(OrderLineCommand line) {
        MenuItem menuItem = menuItemRepository.findById(line.getMenuItemId())
                .filter(MenuItem::isAvailable)
                .orElseThrow(() -> new MenuItemUnavailableException(line.getMenuItemId()));
        return OrderItem.createOrderItem(
                menuItem.getMenuItemId(),
                menuItem.getName(),
                menuItem.getPrice(),
                line.getQuantity(),
                line.getNotes());
    }
}
