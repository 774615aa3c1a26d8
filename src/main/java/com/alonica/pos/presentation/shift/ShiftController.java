package com.alonica.pos.presentation.shift;

import com.alonica.pos.application.shift.ShiftService;
import com.alonica.pos.domain.auth.Actor;
import com.alonica.pos.domain.auth.Capability;
import com.alonica.pos.presentation.common.auth.RequiresCapability;
import com.alonica.pos.presentation.shift.request.AuditNoteRequest;
import com.alonica.pos.presentation.shift.request.CashMovementRequest;
import com.alonica.pos.presentation.shift.request.CloseShiftRequest;
import com.alonica.pos.presentation.shift.request.OpenShiftRequest;
import com.alonica.pos.presentation.shift.response.CashMovementResponse;
import com.alonica.pos.presentation.shift.response.CloseShiftResponse;
import com.alonica.pos.presentation.shift.response.ReconciliationResponse;
import com.alonica.pos.presentation.shift.response.ShiftResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * ShiftController - 교대 근무 및 현금 정산 API
 *
 * 교대를 여는 캐셔는 요청한 Actor 본인이다.
 */
@RestController
@RequestMapping("/shifts")
public class ShiftController {

    private final ShiftService shiftService;

    public ShiftController(ShiftService shiftService) {
        this.shiftService = shiftService;
    }

    /**
     * 교대 시작 (POST /api/shifts)
     */
    @PostMapping
    @RequiresCapability(Capability.MANAGE_SHIFT)
    public ResponseEntity<ShiftResponse> openShift(Actor actor, @Valid @RequestBody OpenShiftRequest request) {
        var result = shiftService.openShift(actor.getUserId(), request.getInitialCash());
        return ResponseEntity.status(HttpStatus.CREATED).body(ShiftResponse.from(result));
    }

    /**
     * 교대 마감 및 정산 (POST /api/shifts/{shift_id}/close)
     */
    @PostMapping("/{shift_id}/close")
    @RequiresCapability(Capability.MANAGE_SHIFT)
    public ResponseEntity<CloseShiftResponse> closeShift(Actor actor,
                                                         @PathVariable("shift_id") Long shiftId,
                                                         @Valid @RequestBody CloseShiftRequest request) {
        var result = shiftService.closeShift(shiftId, actor, request.getFinalCash(), request.getNotes());
        return ResponseEntity.ok(CloseShiftResponse.from(result));
    }

    /**
     * 내 열린 교대 조회 (GET /api/shifts/current)
     * 열린 교대가 없으면 204
     */
    @GetMapping("/current")
    @RequiresCapability(Capability.MANAGE_SHIFT)
    public ResponseEntity<ShiftResponse> getCurrentShift(Actor actor) {
        return shiftService.getCurrentShift(actor.getUserId())
                .map(result -> ResponseEntity.ok(ShiftResponse.from(result)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    /**
     * 정산 미리보기 / 재계산 (GET /api/shifts/{shift_id}/reconciliation)
     */
    @GetMapping("/{shift_id}/reconciliation")
    @RequiresCapability(Capability.MANAGE_SHIFT)
    public ResponseEntity<ReconciliationResponse> getReconciliation(@PathVariable("shift_id") Long shiftId) {
        return ResponseEntity.ok(ReconciliationResponse.from(shiftService.getReconciliation(shiftId)));
    }

    /**
     * 감사 메모 추가 (POST /api/shifts/{shift_id}/audit-notes)
     */
    @PostMapping("/{shift_id}/audit-notes")
    @RequiresCapability(Capability.VIEW_REPORTS)
    public ResponseEntity<ShiftResponse> addAuditNote(Actor actor,
                                                      @PathVariable("shift_id") Long shiftId,
                                                      @Valid @RequestBody AuditNoteRequest request) {
        var result = shiftService.addAuditNote(shiftId, actor.getUserId(), request.getNote());
        return ResponseEntity.ok(ShiftResponse.from(result));
    }

    /**
     * 현금 입출금 기록 (POST /api/shifts/{shift_id}/cash-movements)
     */
    @PostMapping("/{shift_id}/cash-movements")
    @RequiresCapability(Capability.MANAGE_SHIFT)
    public ResponseEntity<CashMovementResponse> recordCashMovement(Actor actor,
                                                                   @PathVariable("shift_id") Long shiftId,
                                                                   @Valid @RequestBody CashMovementRequest request) {
        var result = shiftService.recordCashMovement(shiftId, actor, request.getType(), request.getAmount(),
                request.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(CashMovementResponse.from(result));
    }

    @GetMapping("/{shift_id}/cash-movements")
    @RequiresCapability(Capability.MANAGE_SHIFT)
    public ResponseEntity<List<CashMovementResponse>> listCashMovements(@PathVariable("shift_id") Long shiftId) {
        return ResponseEntity.ok(shiftService.listCashMovements(shiftId).stream()
                .map(CashMovementResponse::from)
                .collect(Collectors.toList()));
    }
}
