package com.alonica.pos.infrastructure.persistence.expense;

import com.alonica.pos.domain.expense.Expense;
import com.alonica.pos.domain.expense.ExpenseRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * InMemoryExpenseRepository - 지출 저장소 구현체 (인메모리)
 */
@Repository
public class InMemoryExpenseRepository implements ExpenseRepository {

    private final ConcurrentHashMap<Long, Expense> expenses = new ConcurrentHashMap<>();
    private long expenseIdSequence = 0L;

    @Override
    public synchronized Expense save(Expense expense) {
        Expense saved = expense.getExpenseId() == null
                ? expense.toBuilder().expenseId(++expenseIdSequence).build()
                : expense;
        expenses.put(saved.getExpenseId(), saved);
        return saved;
    }

    @Override
    public List<Expense> findByRecordedByBetween(Long recordedBy, LocalDateTime from, LocalDateTime to) {
        return expenses.values().stream()
                .filter(expense -> expense.getRecordedBy().equals(recordedBy))
                .filter(expense -> !expense.getCreatedAt().isBefore(from) && !expense.getCreatedAt().isAfter(to))
                .sorted(Comparator.comparing(Expense::getCreatedAt))
                .collect(Collectors.toList());
    }
}
