package com.alonica.pos.application.deletion.dto;

import com.alonica.pos.domain.deletion.DeletionLog;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeletionLogResult {
    private Long logId;
    private Long orderId;
    private Long requestId;
    private Integer itemIndex;
    private String deletedItemName;
    private Integer deletedItemQuantity;
    private Long deletedItemAmount;
    private String itemsBefore;
    private String itemsAfter;
    private Long totalBefore;
    private Long totalAfter;
    private String reason;
    private Long requestedBy;
    private Long authorizedBy;
    private LocalDateTime createdAt;

    public static DeletionLogResult from(DeletionLog log) {
        return DeletionLogResult.builder()
                .logId(log.getLogId())
                .orderId(log.getOrderId())
                .requestId(log.getRequestId())
                .itemIndex(log.getItemIndex())
                .deletedItemName(log.getDeletedItemName())
                .deletedItemQuantity(log.getDeletedItemQuantity())
                .deletedItemAmount(log.getDeletedItemAmount())
                .itemsBefore(log.getItemsBefore())
                .itemsAfter(log.getItemsAfter())
                .totalBefore(log.getTotalBefore())
                .totalAfter(log.getTotalAfter())
                .reason(log.getReason())
                .requestedBy(log.getRequestedBy())
                .authorizedBy(log.getAuthorizedBy())
                .createdAt(log.getCreatedAt())
                .build();
    }
}
