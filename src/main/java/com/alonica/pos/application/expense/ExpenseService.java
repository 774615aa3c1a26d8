package com.alonica.pos.application.expense;

import com.alonica.pos.application.expense.dto.ExpenseResult;
import com.alonica.pos.common.exception.ConflictException;
import com.alonica.pos.common.exception.ErrorCode;
import com.alonica.pos.domain.expense.Expense;
import com.alonica.pos.domain.expense.ExpenseRepository;
import com.alonica.pos.domain.shift.ShiftRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * ExpenseService - 캐셔 지출 기록
 *
 * 지출은 기록한 캐셔의 열린 교대가 있을 때만 허용되며, 교대 마감 시 현금 유출로 집계된다.
 */
@Service
public class ExpenseService {

    private static final Logger log = LoggerFactory.getLogger(ExpenseService.class);

    private final ExpenseRepository expenseRepository;
    private final ShiftRepository shiftRepository;

    public ExpenseService(ExpenseRepository expenseRepository, ShiftRepository shiftRepository) {
        this.expenseRepository = expenseRepository;
        this.shiftRepository = shiftRepository;
    }

    /**
     * @throws ConflictException 열린 교대가 없는 경우 (SHIFT_NOT_OPEN)
     */
    @Transactional
    public ExpenseResult recordExpense(Long recordedBy, long amount, String category, String description) {
        if (shiftRepository.findOpenByCashierId(recordedBy).isEmpty()) {
            throw new ConflictException(ErrorCode.SHIFT_NOT_OPEN, "열린 교대가 없습니다. userId=" + recordedBy);
        }
        Expense saved = expenseRepository.save(Expense.record(recordedBy, amount, category, description));
        log.info("[ExpenseService] 지출 기록 - expenseId={}, recordedBy={}, amount={}, category={}",
                saved.getExpenseId(), recordedBy, amount, saved.getCategory());
        return ExpenseResult.from(saved);
    }
}
