package com.alonica.pos.domain.payment;

import com.alonica.pos.common.exception.ErrorCode;
import com.alonica.pos.common.exception.SystemException;

/**
 * 결제 게이트웨이 호출 실패 (타임아웃, 4XX/5XX 응답, 비활성 상태)
 */
public class PaymentGatewayException extends SystemException {

    public PaymentGatewayException(String detailMessage) {
        super(ErrorCode.EXTERNAL_API_ERROR, detailMessage);
    }

    public PaymentGatewayException(String detailMessage, Throwable cause) {
        super(ErrorCode.EXTERNAL_API_ERROR, detailMessage, cause);
    }
}
