package com.alonica.pos.presentation.refund.request;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 거절 사유 (선택)
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class RejectRequest {
    private String reason;
}
