package com.alonica.pos.presentation.deletion.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 오픈 빌 항목 삭제 요청 DTO
 * item_index는 주문 항목의 0부터 시작하는 위치
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class DeletionRequestRequest {
    @NotNull(message = "주문 ID는 필수입니다")
    @JsonProperty("order_id")
    private Long orderId;

    @NotNull(message = "항목 인덱스는 필수입니다")
    @Min(value = 0, message = "항목 인덱스는 0 이상이어야 합니다")
    @JsonProperty("item_index")
    private Integer itemIndex;

    @NotBlank(message = "삭제 사유는 필수입니다")
    private String reason;
}
