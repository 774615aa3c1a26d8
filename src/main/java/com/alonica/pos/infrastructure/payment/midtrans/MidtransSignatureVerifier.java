package com.alonica.pos.infrastructure.payment.midtrans;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Midtrans 웹훅 서명 검증
 *
 * signature_key = SHA-512(order_id + status_code + gross_amount + serverKey) 의 16진수 소문자 문자열
 */
public class MidtransSignatureVerifier {

    private final String serverKey;

    public MidtransSignatureVerifier(String serverKey) {
        this.serverKey = serverKey;
    }

    public String sign(String orderId, String statusCode, String grossAmount) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-512");
            byte[] hash = digest.digest((orderId + statusCode + grossAmount + serverKey)
                    .getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-512 알고리즘을 사용할 수 없습니다", e);
        }
    }

    /**
     * 서명 일치 여부 (상수 시간 비교)
     */
    public boolean verify(String orderId, String statusCode, String grossAmount, String signatureKey) {
        if (serverKey == null || serverKey.isBlank() || signatureKey == null
                || orderId == null || statusCode == null || grossAmount == null) {
            return false;
        }
        String expected = sign(orderId, statusCode, grossAmount);
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                signatureKey.toLowerCase().getBytes(StandardCharsets.UTF_8));
    }
}
