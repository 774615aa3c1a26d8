package com.alonica.pos.domain.menu;

import com.alonica.pos.common.exception.DomainException;
import com.alonica.pos.common.exception.ErrorCode;

/**
 * 존재하지 않거나 판매 중지된 메뉴를 주문할 때 발생 (400)
 */
public class MenuItemUnavailableException extends DomainException {

    public MenuItemUnavailableException(Long menuItemId) {
        super(ErrorCode.MENU_ITEM_UNAVAILABLE, "menuItemId=" + menuItemId);
    }
}
