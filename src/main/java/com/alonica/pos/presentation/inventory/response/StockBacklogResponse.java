package com.alonica.pos.presentation.inventory.response;

import com.alonica.pos.domain.inventory.StockDeductionBacklog;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 재처리 대기 중인 재고 차감 백로그 응답
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockBacklogResponse {
    @JsonProperty("backlog_id")
    private Long backlogId;

    @JsonProperty("order_id")
    private Long orderId;

    private String lines;

    private String reason;

    private String status;

    private int attempts;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("last_attempt_at")
    private LocalDateTime lastAttemptAt;

    public static StockBacklogResponse from(StockDeductionBacklog backlog) {
        return StockBacklogResponse.builder()
                .backlogId(backlog.getBacklogId())
                .orderId(backlog.getOrderId())
                .lines(backlog.getLinesSnapshot())
                .reason(backlog.getReason())
                .status(backlog.getStatus().name())
                .attempts(backlog.getAttempts())
                .createdAt(backlog.getCreatedAt())
                .lastAttemptAt(backlog.getLastAttemptAt())
                .build();
    }
}
