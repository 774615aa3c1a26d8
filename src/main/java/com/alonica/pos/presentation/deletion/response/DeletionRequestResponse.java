package com.alonica.pos.presentation.deletion.response;

import com.alonica.pos.application.deletion.dto.DeletionRequestResult;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeletionRequestResponse {
    @JsonProperty("request_id")
    private Long requestId;

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("item_index")
    private Integer itemIndex;

    @JsonProperty("menu_item_id")
    private Long menuItemId;

    @JsonProperty("item_name")
    private String itemName;

    @JsonProperty("item_quantity")
    private Integer itemQuantity;

    @JsonProperty("item_amount")
    private Long itemAmount;

    private String reason;

    private String status;

    @JsonProperty("requested_by")
    private Long requestedBy;

    @JsonProperty("authorized_by")
    private Long authorizedBy;

    @JsonProperty("rejection_reason")
    private String rejectionReason;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("decided_at")
    private LocalDateTime decidedAt;

    public static DeletionRequestResponse from(DeletionRequestResult result) {
        return DeletionRequestResponse.builder()
                .requestId(result.getRequestId())
                .orderId(result.getOrderId())
                .itemIndex(result.getItemIndex())
                .menuItemId(result.getMenuItemId())
                .itemName(result.getItemName())
                .itemQuantity(result.getItemQuantity())
                .itemAmount(result.getItemAmount())
                .reason(result.getReason())
                .status(result.getStatus())
                .requestedBy(result.getRequestedBy())
                .authorizedBy(result.getAuthorizedBy())
                .rejectionReason(result.getRejectionReason())
                .createdAt(result.getCreatedAt())
                .decidedAt(result.getDecidedAt())
                .build();
    }
}
