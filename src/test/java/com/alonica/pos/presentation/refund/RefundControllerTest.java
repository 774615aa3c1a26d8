package com.alonica.pos.presentation.refund;

import com.alonica.pos.application.refund.RefundService;
import com.alonica.pos.application.refund.dto.RefundResult;
import com.alonica.pos.domain.refund.RefundLimitExceededException;
import com.alonica.pos.presentation.common.GlobalExceptionHandler;
import com.alonica.pos.presentation.common.auth.ActorArgumentResolver;
import com.alonica.pos.presentation.common.auth.AuthorizationInterceptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 환불 요청은 캐셔, 승인/거절은 ADMIN만 가능
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RefundController 단위 테스트")
class RefundControllerTest {

    private static final String REFUND_BODY = "{\"order_id\":5001,\"refund_amount\":20000,"
            + "\"refund_type\":\"CASH\",\"reason\":\"salah pesan\"}";

    private MockMvc mockMvc;

    @Mock
    private RefundService refundService;

    @BeforeEach
    void setup() {
        this.mockMvc = MockMvcBuilders.standaloneSetup(new RefundController(refundService))
                .addInterceptors(new AuthorizationInterceptor())
                .setCustomArgumentResolvers(new ActorArgumentResolver())
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static RefundResult refund(String status, Long authorizedBy) {
        return RefundResult.builder()
                .refundId(1L)
                .orderId(5001L)
                .refundAmount(20000L)
                .refundType("CASH")
                .reason("salah pesan")
                .status(status)
                .requestedBy(7L)
                .authorizedBy(authorizedBy)
                .build();
    }

    @Test
    @DisplayName("환불 요청 - 캐셔 권한으로 201, 요청자 기록")
    void testRequestRefund_Success() throws Exception {
        // Given
        when(refundService.requestRefund(5001L, 20000L, "CASH", "salah pesan", 7L))
                .thenReturn(refund("PENDING", null));

        // When & Then
        mockMvc.perform(post("/refunds")
                        .header("X-USER-ID", "7")
                        .header("X-USER-ROLE", "kasir")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REFUND_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.refund_id").value(1))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.requested_by").value(7));
    }

    @Test
    @DisplayName("환불 요청 - 환불 가능 금액 초과 시 400")
    void testRequestRefund_LimitExceeded() throws Exception {
        // Given
        when(refundService.requestRefund(anyLong(), anyLong(), anyString(), anyString(), anyLong()))
                .thenThrow(new RefundLimitExceededException(5001L, 20000L, 10000L));

        // When & Then
        mockMvc.perform(post("/refunds")
                        .header("X-USER-ID", "7")
                        .header("X-USER-ROLE", "kasir")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REFUND_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_REFUND_LIMIT_EXCEEDED"));
    }

    @Test
    @DisplayName("환불 승인 - 캐셔는 403, ADMIN은 200")
    void testApprove_RequiresAdmin() throws Exception {
        mockMvc.perform(post("/refunds/1/approve")
                        .header("X-USER-ID", "7")
                        .header("X-USER-ROLE", "kasir"))
                .andExpect(status().isForbidden());
        verifyNoInteractions(refundService);

        // Given
        when(refundService.approveRefund(1L, 1L)).thenReturn(refund("APPROVED", 1L));

        // When & Then
        mockMvc.perform(post("/refunds/1/approve")
                        .header("X-USER-ID", "1")
                        .header("X-USER-ROLE", "admin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"))
                .andExpect(jsonPath("$.authorized_by").value(1));
    }

    @Test
    @DisplayName("환불 거절 - 본문 없이도 처리")
    void testReject_WithoutBody() throws Exception {
        // Given
        when(refundService.rejectRefund(1L, 1L, null)).thenReturn(refund("REJECTED", 1L));

        // When & Then
        mockMvc.perform(post("/refunds/1/reject")
                        .header("X-USER-ID", "1")
                        .header("X-USER-ROLE", "admin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REJECTED"));
    }
}
