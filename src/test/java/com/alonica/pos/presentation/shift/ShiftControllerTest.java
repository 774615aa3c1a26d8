package com.alonica.pos.presentation.shift;

import com.alonica.pos.application.shift.ShiftService;
import com.alonica.pos.application.shift.dto.CloseShiftResult;
import com.alonica.pos.application.shift.dto.ReconciliationResult;
import com.alonica.pos.application.shift.dto.ShiftResult;
import com.alonica.pos.domain.auth.Actor;
import com.alonica.pos.domain.auth.UserRole;
import com.alonica.pos.domain.shift.ShiftAlreadyOpenException;
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

import java.time.LocalDateTime;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ShiftController 단위 테스트")
class ShiftControllerTest {

    private MockMvc mockMvc;

    @Mock
    private ShiftService shiftService;

    @BeforeEach
    void setup() {
        this.mockMvc = MockMvcBuilders.standaloneSetup(new ShiftController(shiftService))
                .addInterceptors(new AuthorizationInterceptor())
                .setCustomArgumentResolvers(new ActorArgumentResolver())
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static ShiftResult openShift() {
        return ShiftResult.builder()
                .shiftId(1L)
                .cashierId(7L)
                .status("OPEN")
                .initialCash(100000L)
                .startTime(LocalDateTime.of(2024, 5, 1, 8, 0))
                .build();
    }

    @Test
    @DisplayName("교대 시작 - 요청자 본인이 캐셔로 기록되어 201")
    void testOpenShift_Success() throws Exception {
        // Given
        when(shiftService.openShift(7L, 100000L)).thenReturn(openShift());

        // When & Then
        mockMvc.perform(post("/shifts")
                        .header("X-USER-ID", "7")
                        .header("X-USER-ROLE", "kasir")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"initial_cash\":100000}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.shift_id").value(1))
                .andExpect(jsonPath("$.cashier_id").value(7))
                .andExpect(jsonPath("$.status").value("OPEN"));
    }

    @Test
    @DisplayName("교대 시작 - 이미 열린 교대가 있으면 409")
    void testOpenShift_AlreadyOpen() throws Exception {
        // Given
        when(shiftService.openShift(anyLong(), anyLong())).thenThrow(new ShiftAlreadyOpenException(7L, 1L));

        // When & Then
        mockMvc.perform(post("/shifts")
                        .header("X-USER-ID", "7")
                        .header("X-USER-ROLE", "kasir")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"initial_cash\":100000}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_SHIFT_ALREADY_OPEN"));
    }

    @Test
    @DisplayName("교대 시작 - 음수 시작 현금은 400, 주방 권한은 403")
    void testOpenShift_Invalid() throws Exception {
        mockMvc.perform(post("/shifts")
                        .header("X-USER-ID", "7")
                        .header("X-USER-ROLE", "kasir")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"initial_cash\":-1}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/shifts")
                        .header("X-USER-ID", "9")
                        .header("X-USER-ROLE", "kitchen")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"initial_cash\":100000}"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(shiftService);
    }

    @Test
    @DisplayName("교대 마감 - 정산 결과와 차액 반환")
    void testCloseShift() throws Exception {
        // Given
        ReconciliationResult reconciliation = ReconciliationResult.builder()
                .shiftId(1L)
                .initialCash(100000L)
                .systemCash(130000L)
                .finalCash(125000L)
                .cashDifference(-5000L)
                .build();
        when(shiftService.closeShift(eq(1L), any(Actor.class), eq(125000L), eq("kurang")))
                .thenReturn(new CloseShiftResult(openShift(), reconciliation));

        // When & Then
        mockMvc.perform(post("/shifts/1/close")
                        .header("X-USER-ID", "7")
                        .header("X-USER-ROLE", "kasir")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"final_cash\":125000,\"notes\":\"kurang\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.shift.shift_id").value(1))
                .andExpect(jsonPath("$.reconciliation.system_cash").value(130000))
                .andExpect(jsonPath("$.reconciliation.cash_difference").value(-5000));

        verify(shiftService).closeShift(eq(1L), eq(Actor.of(7L, UserRole.KASIR)), eq(125000L), eq("kurang"));
    }

    @Test
    @DisplayName("현재 교대 조회 - 열린 교대가 없으면 204")
    void testGetCurrentShift_NoContent() throws Exception {
        // Given
        when(shiftService.getCurrentShift(7L)).thenReturn(Optional.empty());

        // When & Then
        mockMvc.perform(get("/shifts/current")
                        .header("X-USER-ID", "7")
                        .header("X-USER-ROLE", "kasir"))
                .andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("감사 메모 - 보고서 권한(ADMIN)만 가능")
    void testAddAuditNote_RequiresAdmin() throws Exception {
        mockMvc.perform(post("/shifts/1/audit-notes")
                        .header("X-USER-ID", "7")
                        .header("X-USER-ROLE", "kasir")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"note\":\"cek ulang\"}"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(shiftService);
    }
}
