package com.alonica.pos.application.openbill.dto;

import com.alonica.pos.application.order.dto.OrderLineCommand;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 오픈 빌 생성/스마트 병합 커맨드
 * paymentMethod가 null이면 CASH
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenBillCommand {
    private String customerName;
    private String tableNumber;
    private List<OrderLineCommand> items;
    private String paymentMethod;
}
