package com.alonica.pos.domain.expense;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 지출 영속성 Port
 */
public interface ExpenseRepository {

    Expense save(Expense expense);

    /**
     * 기록자와 기간 [from, to]로 지출 조회
     */
    List<Expense> findByRecordedByBetween(Long recordedBy, LocalDateTime from, LocalDateTime to);
}
