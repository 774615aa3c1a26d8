package com.alonica.pos.infrastructure.payment.midtrans;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MidtransSignatureVerifier 테스트")
class MidtransSignatureVerifierTest {

    private static final String SERVER_KEY = "SB-Mid-server-test";
    private static final String EXPECTED_SIGNATURE =
            "afc922c1d549b64dc0923f13ffed81d1c33aa2e6f80839b9401d857da8b11514"
                    + "dc111be00458df5f235d3edb179d1b6630a23d65c5cd81d0041d2c911289b6f9";

    private final MidtransSignatureVerifier verifier = new MidtransSignatureVerifier(SERVER_KEY);

    @Test
    @DisplayName("SHA-512(order_id + status_code + gross_amount + serverKey) 16진수")
    void testSign() {
        assertEquals(EXPECTED_SIGNATURE, verifier.sign("ALONICA-1001", "200", "50000.00"));
    }

    @Test
    @DisplayName("서명 검증 - 대문자 서명도 허용, 금액이 다르면 실패")
    void testVerify() {
        assertTrue(verifier.verify("ALONICA-1001", "200", "50000.00", EXPECTED_SIGNATURE));
        assertTrue(verifier.verify("ALONICA-1001", "200", "50000.00", EXPECTED_SIGNATURE.toUpperCase()));
        assertFalse(verifier.verify("ALONICA-1001", "200", "50001.00", EXPECTED_SIGNATURE));
        assertFalse(verifier.verify("ALONICA-1001", "200", "50000.00", null));
    }

    @Test
    @DisplayName("서버 키가 없으면 항상 검증 실패")
    void testVerify_NoServerKey() {
        MidtransSignatureVerifier disabled = new MidtransSignatureVerifier("");

        assertFalse(disabled.verify("ALONICA-1001", "200", "50000.00", EXPECTED_SIGNATURE));
    }
}
