package com.alonica.pos.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 역할:
 * - 모든 비즈니스 예외의 코드와 메시지 정의
 * - HTTP 상태 코드 매핑
 * - 일관된 에러 응답 제공
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: DOMAIN_ORDER_NOT_FOUND, APP_WEBHOOK_PROCESSING_FAILED
 */
public enum ErrorCode {

    // ========== Domain Layer Errors (4XX) ==========

    INVALID_REQUEST("DOMAIN_INVALID_REQUEST", "잘못된 요청입니다", 400),

    // Auth
    UNAUTHENTICATED("DOMAIN_AUTH_UNAUTHENTICATED", "인증 정보가 없습니다", 401),
    FORBIDDEN("DOMAIN_AUTH_FORBIDDEN", "해당 작업에 대한 권한이 없습니다", 403),

    // Order Domain
    ORDER_NOT_FOUND("DOMAIN_ORDER_NOT_FOUND", "주문을 찾을 수 없습니다", 404),
    ORDER_ITEMS_EMPTY("DOMAIN_ORDER_ITEMS_EMPTY", "주문 항목이 비어 있습니다", 400),
    INVALID_ORDER_STATUS_TRANSITION("DOMAIN_ORDER_INVALID_STATUS_TRANSITION", "주문 상태를 변경할 수 없습니다", 409),
    INSUFFICIENT_CASH_RECEIVED("DOMAIN_ORDER_INSUFFICIENT_CASH_RECEIVED", "받은 금액이 결제 금액보다 적습니다", 400),
    ORDER_ALREADY_PAID("DOMAIN_ORDER_ALREADY_PAID", "이미 결제된 주문입니다", 409),
    OPEN_BILL_NOT_OPEN("DOMAIN_ORDER_OPEN_BILL_NOT_OPEN", "더 이상 수정할 수 없는 오픈 빌입니다", 409),

    // Menu Domain
    MENU_ITEM_UNAVAILABLE("DOMAIN_MENU_ITEM_UNAVAILABLE", "주문할 수 없는 메뉴입니다", 400),

    // Inventory Domain
    INSUFFICIENT_STOCK("DOMAIN_INVENTORY_INSUFFICIENT_STOCK", "재료 재고가 부족합니다", 400),

    // Shift Domain
    SHIFT_NOT_FOUND("DOMAIN_SHIFT_NOT_FOUND", "교대 근무를 찾을 수 없습니다", 404),
    SHIFT_ALREADY_OPEN("DOMAIN_SHIFT_ALREADY_OPEN", "이미 열린 교대 근무가 있습니다", 409),
    SHIFT_NOT_OPEN("DOMAIN_SHIFT_NOT_OPEN", "열린 교대 근무가 아닙니다", 409),
    SHIFT_OWNER_MISMATCH("DOMAIN_SHIFT_OWNER_MISMATCH", "본인의 교대 근무가 아닙니다", 403),

    // Refund Domain
    REFUND_NOT_FOUND("DOMAIN_REFUND_NOT_FOUND", "환불 요청을 찾을 수 없습니다", 404),
    REFUND_ORDER_NOT_PAID("DOMAIN_REFUND_ORDER_NOT_PAID", "결제되지 않은 주문은 환불할 수 없습니다", 409),
    REFUND_LIMIT_EXCEEDED("DOMAIN_REFUND_LIMIT_EXCEEDED", "환불 가능 금액을 초과했습니다", 400),
    INVALID_REFUND_STATUS("DOMAIN_REFUND_INVALID_STATUS", "환불 요청 상태를 변경할 수 없습니다", 409),

    // Deletion Domain
    DELETION_REQUEST_NOT_FOUND("DOMAIN_DELETION_REQUEST_NOT_FOUND", "삭제 요청을 찾을 수 없습니다", 404),
    INVALID_ITEM_INDEX("DOMAIN_DELETION_INVALID_ITEM_INDEX", "유효하지 않은 주문 항목 인덱스입니다", 400),
    LAST_ITEM_DELETION("DOMAIN_DELETION_LAST_ITEM", "마지막 남은 주문 항목은 삭제할 수 없습니다", 400),
    DELETION_NOT_ALLOWED("DOMAIN_DELETION_NOT_ALLOWED", "항목을 삭제할 수 없는 주문입니다", 409),
    DELETION_REQUEST_ALREADY_DECIDED("DOMAIN_DELETION_ALREADY_DECIDED", "이미 처리된 삭제 요청입니다", 409),
    DELETION_TARGET_CHANGED("DOMAIN_DELETION_TARGET_CHANGED", "삭제 대상 항목이 요청 이후 변경되었습니다", 409),

    // ========== Application Layer Errors (5XX) ==========

    WEBHOOK_PROCESSING_FAILED("APP_WEBHOOK_PROCESSING_FAILED", "결제 알림 처리에 실패했습니다", 500),

    // ========== System Errors (5XX) ==========

    EXTERNAL_API_ERROR("SYSTEM_EXTERNAL_API_ERROR", "외부 API 호출에 실패했습니다", 503),
    INTERNAL_SERVER_ERROR("SYSTEM_INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int statusCode;

    ErrorCode(String code, String message, int statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
