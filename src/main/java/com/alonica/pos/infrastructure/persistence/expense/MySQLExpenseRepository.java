package com.alonica.pos.infrastructure.persistence.expense;

import com.alonica.pos.domain.expense.Expense;
import com.alonica.pos.domain.expense.ExpenseRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * MySQL 기반 지출 Repository 구현
 */
@Repository
public class MySQLExpenseRepository implements ExpenseRepository {

    private final ExpenseJpaRepository expenseJpaRepository;

    public MySQLExpenseRepository(ExpenseJpaRepository expenseJpaRepository) {
        this.expenseJpaRepository = expenseJpaRepository;
    }

    @Override
    public Expense save(Expense expense) {
        return expenseJpaRepository.save(expense);
    }

    @Override
    public List<Expense> findByRecordedByBetween(Long recordedBy, LocalDateTime from, LocalDateTime to) {
        return expenseJpaRepository.findByRecordedByAndCreatedAtBetweenOrderByCreatedAtAsc(recordedBy, from, to);
    }
}
