package com.alonica.pos.application.shift;

import com.alonica.pos.common.exception.DomainException;
import com.alonica.pos.common.exception.ErrorCode;
import com.alonica.pos.domain.auth.Actor;
import com.alonica.pos.domain.shift.CashMovement;
import com.alonica.pos.domain.shift.CashMovementRepository;
import com.alonica.pos.domain.shift.CashMovementType;
import com.alonica.pos.domain.shift.Shift;
import com.alonica.pos.domain.shift.ShiftAlreadyOpenException;
import com.alonica.pos.domain.shift.ShiftNotFoundException;
import com.alonica.pos.domain.shift.ShiftReconciliation;
import com.alonica.pos.domain.shift.ShiftRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * ShiftTransactionService - 교대 근무 트랜잭션 (2단계)
 *
 * 마감과 현금 입출금은 같은 교대 행을 PESSIMISTIC_WRITE로 잠그므로,
 * 입출금은 마감 전에 완전히 기록되거나 마감 후에 거절된다.
 */
@Service
public class ShiftTransactionService {

    private static final Logger log = LoggerFactory.getLogger(ShiftTransactionService.class);

    private final ShiftRepository shiftRepository;
    private final CashMovementRepository cashMovementRepository;
    private final ShiftReconciliationService reconciliationService;

    public ShiftTransactionService(ShiftRepository shiftRepository,
                                   CashMovementRepository cashMovementRepository,
                                   ShiftReconciliationService reconciliationService) {
        this.shiftRepository = shiftRepository;
        this.cashMovementRepository = cashMovementRepository;
        this.reconciliationService = reconciliationService;
    }

    /**
     * 교대 시작 (캐셔당 열린 교대는 최대 1개)
     *
     * @throws ShiftAlreadyOpenException 이미 열린 교대가 있는 경우
     */
    @Transactional
    public Shift open(Long cashierId, long initialCash) {
        shiftRepository.findOpenByCashierId(cashierId).ifPresent(existing -> {
            throw new ShiftAlreadyOpenException(cashierId, existing.getShiftId());
        });
        Shift saved = shiftRepository.save(Shift.open(cashierId, initialCash));
        log.info("[ShiftTransactionService] 교대 시작 - shiftId={}, cashierId={}, initialCash={}",
                saved.getShiftId(), cashierId, initialCash);
        return saved;
    }

    @Transactional
    public CashMovement recordCashMovement(Long shiftId, Actor actor, CashMovementType type, long amount,
                                           String description) {
        Shift shift = lockOwned(shiftId, actor);
        CashMovement saved = cashMovementRepository.save(
                CashMovement.record(shift, actor.getUserId(), type, amount, description));
        log.info("[ShiftTransactionService] 현금 입출금 기록 - shiftId={}, type={}, amount={}",
                shiftId, type, amount);
        return saved;
    }

    /**
     * 교대 마감 (한 트랜잭션, 교대 행 잠금)
     */
    @Transactional
    public ClosedShift close(Long shiftId, Actor actor, long finalCash, String notes) {
        if (finalCash < 0) {
            throw new IllegalArgumentException("마감 현금은 음수가 될 수 없습니다");
        }
        Shift shift = lockOwned(shiftId, actor);
        shift.ensureOpen();

        LocalDateTime now = LocalDateTime.now();
        ShiftReconciliation reconciliation = reconciliationService.reconcile(shift, now, finalCash);
        shift.close(reconciliation, notes, now);
        Shift saved = shiftRepository.save(shift);

        log.info("[ShiftTransactionService] 교대 마감 - shiftId={}, systemCash={}, finalCash={}, difference={}",
                shiftId, reconciliation.getSystemCash(), finalCash, reconciliation.getCashDifference());
        return new ClosedShift(saved, reconciliation);
    }

    @Transactional
    public Shift addAuditNote(Long shiftId, Long auditorId, String note) {
        Shift shift = shiftRepository.findByIdForUpdate(shiftId)
                .orElseThrow(() -> new ShiftNotFoundException(shiftId));
        shift.addAuditNote(auditorId, note);
        log.info("[ShiftTransactionService] 감사 메모 추가 - shiftId={}, auditorId={}", shiftId, auditorId);
        return shiftRepository.save(shift);
    }

    private Shift lockOwned(Long shiftId, Actor actor) {
        Shift shift = shiftRepository.findByIdForUpdate(shiftId)
                .orElseThrow(() -> new ShiftNotFoundException(shiftId));
        if (!shift.isOwnedBy(actor.getUserId()) && !actor.isAdmin()) {
            throw new DomainException(ErrorCode.SHIFT_OWNER_MISMATCH,
                    "shiftId=" + shiftId + ", userId=" + actor.getUserId());
        }
        return shift;
    }

    /**
     * 마감된 교대와 마감 시점 정산 결과
     */
    public static class ClosedShift {
        private final Shift shift;
        private final ShiftReconciliation reconciliation;

        public ClosedShift(Shift shift, ShiftReconciliation reconciliation) {
            this.shift = shift;
            this.reconciliation = reconciliation;
        }

        public Shift getShift() {
            return shift;
        }

        public ShiftReconciliation getReconciliation() {
            return reconciliation;
        }
    }
}
