package com.alonica.pos.application.deletion.dto;

import com.alonica.pos.domain.deletion.DeletionRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeletionRequestResult {
    private Long requestId;
    private Long orderId;
    private Integer itemIndex;
    private Long menuItemId;
    private String itemName;
    private Integer itemQuantity;
    private Long itemAmount;
    private String reason;
    private String status;
    private Long requestedBy;
    private Long authorizedBy;
    private String rejectionReason;
    private LocalDateTime createdAt;
    private LocalDateTime decidedAt;

    public static DeletionRequestResult from(DeletionRequest request) {
        return DeletionRequestResult.builder()
                .requestId(request.getRequestId())
                .orderId(request.getOrderId())
                .itemIndex(request.getItemIndex())
                .menuItemId(request.getItemSnapshot().getMenuItemId())
                .itemName(request.getItemSnapshot().getName())
                .itemQuantity(request.getItemSnapshot().getQuantity())
                .itemAmount(request.getItemSnapshot().getLineTotal())
                .reason(request.getReason())
                .status(request.getStatus().name())
                .requestedBy(request.getRequestedBy())
                .authorizedBy(request.getAuthorizedBy())
                .rejectionReason(request.getRejectionReason())
                .createdAt(request.getCreatedAt())
                .decidedAt(request.getDecidedAt())
                .build();
    }
}
