package com.alonica.pos.domain.auth;

/**
 * 역할별로 부여되는 작업 권한
 */
public enum Capability {
    CREATE_ORDER,
    VIEW_ORDERS,
    UPDATE_ORDER_STATUS,
    MANAGE_OPEN_BILL,
    MANAGE_SHIFT,
    RECORD_EXPENSE,
    REQUEST_REFUND,
    AUTHORIZE_REFUND,
    REQUEST_DELETION,
    AUTHORIZE_DELETION,
    VIEW_INVENTORY,
    VIEW_REPORTS
}
