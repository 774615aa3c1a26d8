package com.alonica.pos.presentation.shift.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class OpenShiftRequest {
    @NotNull(message = "시작 현금은 필수입니다")
    @Min(value = 0, message = "시작 현금은 음수가 될 수 없습니다")
    @JsonProperty("initial_cash")
    private Long initialCash;
}
