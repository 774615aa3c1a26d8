package com.alonica.pos.infrastructure.persistence.expense;

import com.alonica.pos.domain.expense.Expense;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Expense JPA Repository
 */
public interface ExpenseJpaRepository extends JpaRepository<Expense, Long> {

    List<Expense> findByRecordedByAndCreatedAtBetweenOrderByCreatedAtAsc(Long recordedBy, LocalDateTime from,
                                                                        LocalDateTime to);
}
