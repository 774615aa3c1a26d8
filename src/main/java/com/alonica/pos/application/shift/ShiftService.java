package com.alonica.pos.application.shift;

import com.alonica.pos.application.shift.dto.CashMovementResult;
import com.alonica.pos.application.shift.dto.CloseShiftResult;
import com.alonica.pos.application.shift.dto.ReconciliationResult;
import com.alonica.pos.application.shift.dto.ShiftResult;
import com.alonica.pos.domain.auth.Actor;
import com.alonica.pos.domain.shift.CashMovementRepository;
import com.alonica.pos.domain.shift.CashMovementType;
import com.alonica.pos.domain.shift.Shift;
import com.alonica.pos.domain.shift.ShiftNotFoundException;
import com.alonica.pos.domain.shift.ShiftReconciliation;
import com.alonica.pos.domain.shift.ShiftRepository;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * ShiftService - 교대 근무와 현금 정산 흐름 조정자
 *
 * 교대 시작은 캐셔 단위 프로세스 내 잠금 안에서 "열린 교대 조회 → 생성"을 수행한다.
 * 같은 캐셔의 동시 시작 요청 중 하나만 성공하고 나머지는 ShiftAlreadyOpenException(409).
 *
 * 현금 입출금, 마감, 감사 메모는 교대 단위 잠금 안에서 실행된다.
 * 입출금은 마감 정산에 완전히 포함되거나 마감 이후 거절되며, 집계에서 누락되지 않는다.
 * (DB 모드에서는 교대 행 비관적 잠금이 같은 보장을 하며, 인메모리 모드에서는 이 잠금이 유일한 보장)
 */
@Service
public class ShiftService {

    private final ShiftRepository shiftRepository;
    private final CashMovementRepository cashMovementRepository;
    private final ShiftTransactionService shiftTransactionService;
    private final ShiftReconciliationService reconciliationService;
    private final ConcurrentHashMap<Long, Object> cashierLocks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, Object> shiftLocks = new ConcurrentHashMap<>();

    public ShiftService(ShiftRepository shiftRepository,
                        CashMovementRepository cashMovementRepository,
                        ShiftTransactionService shiftTransactionService,
                        ShiftReconciliationService reconciliationService) {
        this.shiftRepository = shiftRepository;
        this.cashMovementRepository = cashMovementRepository;
        this.shiftTransactionService = shiftTransactionService;
        this.reconciliationService = reconciliationService;
    }

    public ShiftResult openShift(Long cashierId, long initialCash) {
        Object lock = cashierLocks.computeIfAbsent(cashierId, key -> new Object());
        synchronized (lock) {
            return ShiftResult.fromShift(shiftTransactionService.open(cashierId, initialCash));
        }
    }

    public CashMovementResult recordCashMovement(Long shiftId, Actor actor, String type, long amount,
                                                 String description) {
        CashMovementType movementType = CashMovementType.fromString(type);
        synchronized (shiftLock(shiftId)) {
            return CashMovementResult.from(shiftTransactionService.recordCashMovement(
                    shiftId, actor, movementType, amount, description));
        }
    }

    public CloseShiftResult closeShift(Long shiftId, Actor actor, long finalCash, String notes) {
        ShiftTransactionService.ClosedShift closed;
        synchronized (shiftLock(shiftId)) {
            closed = shiftTransactionService.close(shiftId, actor, finalCash, notes);
        }
        Shift shift = closed.getShift();
        return CloseShiftResult.builder()
                .shift(ShiftResult.fromShift(shift))
                .reconciliation(ReconciliationResult.of(shiftId, false, shift.getStartTime(), shift.getEndTime(),
                        closed.getReconciliation()))
                .build();
    }

    public Optional<ShiftResult> getCurrentShift(Long cashierId) {
        return shiftRepository.findOpenByCashierId(cashierId)
                .map(ShiftResult::fromShift);
    }

    /**
     * 정산 조회
     *
     * - 열린 교대: 현재 시점까지의 미리보기 (finalCash 없음)
     * - 마감된 교대: [startTime, endTime] 원장으로 다시 계산 (감사용), 마감 시점 저장 값과 차이 포함
     */
    public ReconciliationResult getReconciliation(Long shiftId) {
        Shift shift = shiftRepository.findById(shiftId)
                .orElseThrow(() -> new ShiftNotFoundException(shiftId));
        boolean preview = shift.isOpen();
        LocalDateTime windowEnd = preview ? LocalDateTime.now() : shift.getEndTime();
        ShiftReconciliation reconciliation = reconciliationService.reconcile(
                shift, windowEnd, preview ? null : shift.getFinalCash());
        ReconciliationResult result = ReconciliationResult.of(
                shiftId, preview, shift.getStartTime(), windowEnd, reconciliation);
        if (preview) {
            return result;
        }
        return result.withRecorded(shift.getSystemCash(), shift.getCashDifference());
    }

    public ShiftResult addAuditNote(Long shiftId, Long auditorId, String note) {
        synchronized (shiftLock(shiftId)) {
            return ShiftResult.fromShift(shiftTransactionService.addAuditNote(shiftId, auditorId, note));
        }
    }

    public List<CashMovementResult> listCashMovements(Long shiftId) {
        shiftRepository.findById(shiftId)
                .orElseThrow(() -> new ShiftNotFoundException(shiftId));
        return cashMovementRepository.findByShiftId(shiftId).stream()
                .map(CashMovementResult::from)
                .collect(Collectors.toList());
    }

    private Object shiftLock(Long shiftId) {
        return shiftLocks.computeIfAbsent(shiftId, key -> new Object());
    }
}
