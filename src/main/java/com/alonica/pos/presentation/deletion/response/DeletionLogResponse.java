package com.alonica.pos.presentation.deletion.response;

import com.alonica.pos.application.deletion.dto.DeletionLogResult;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 삭제 감사 로그 응답
 * items_before / items_after는 저장된 JSON 스냅샷 문자열 그대로 전달한다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeletionLogResponse {
    @JsonProperty("log_id")
    private Long logId;

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("request_id")
    private Long requestId;

    @JsonProperty("item_index")
    private Integer itemIndex;

    @JsonProperty("deleted_item_name")
    private String deletedItemName;

    @JsonProperty("deleted_item_quantity")
    private Integer deletedItemQuantity;

    @JsonProperty("deleted_item_amount")
    private Long deletedItemAmount;

    @JsonProperty("items_before")
    private String itemsBefore;

    @JsonProperty("items_after")
    private String itemsAfter;

    @JsonProperty("total_before")
    private Long totalBefore;

    @JsonProperty("total_after")
    private Long totalAfter;

    private String reason;

    @JsonProperty("requested_by")
    private Long requestedBy;

    @JsonProperty("authorized_by")
    private Long authorizedBy;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    public static DeletionLogResponse from(DeletionLogResult result) {
        return DeletionLogResponse.builder()
                .logId(result.getLogId())
                .orderId(result.getOrderId())
                .requestId(result.getRequestId())
                .itemIndex(result.getItemIndex())
                .deletedItemName(result.getDeletedItemName())
                .deletedItemQuantity(result.getDeletedItemQuantity())
                .deletedItemAmount(result.getDeletedItemAmount())
                .itemsBefore(result.getItemsBefore())
                .itemsAfter(result.getItemsAfter())
                .totalBefore(result.getTotalBefore())
                .totalAfter(result.getTotalAfter())
                .reason(result.getReason())
                .requestedBy(result.getRequestedBy())
                .authorizedBy(result.getAuthorizedBy())
                .createdAt(result.getCreatedAt())
                .build();
    }
}
