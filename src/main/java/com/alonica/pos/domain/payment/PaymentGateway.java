package com.alonica.pos.domain.payment;

/**
 * PaymentGateway - 외부 QRIS 결제 게이트웨이 연동 Port
 *
 * 구현체: MidtransPaymentGateway (Midtrans Core API)
 *
 * 주요 기능:
 * - createQrisCharge: QRIS 결제 생성
 * - queryStatus: 거래 상태 조회 (클라이언트 폴링 경로)
 * - verifySignature: 웹훅 서명 검증
 *
 * 게이트웨이 호출 실패는 PaymentGatewayException으로 전달되며,
 * 주문 생성 경로에서는 호출자가 모의 결제로 대체한다.
 */
public interface PaymentGateway {

    /**
     * 서버 키가 설정되어 실제 게이트웨이를 호출할 수 있는지 여부
     */
    boolean isEnabled();

    QrisCharge createQrisCharge(QrisChargeRequest request);

    GatewayTransactionStatus queryStatus(String gatewayOrderId);

    boolean verifySignature(String gatewayOrderId, String statusCode, String grossAmount, String signatureKey);

    /**
     * 클라이언트(스냅/QR 화면)에 노출 가능한 설정
     */
    String getClientKey();

    boolean isProduction();
}
