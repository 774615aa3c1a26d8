package com.alonica.pos.presentation.expense;

import com.alonica.pos.application.expense.ExpenseService;
import com.alonica.pos.domain.auth.Actor;
import com.alonica.pos.domain.auth.Capability;
import com.alonica.pos.presentation.common.auth.RequiresCapability;
import com.alonica.pos.presentation.expense.request.RecordExpenseRequest;
import com.alonica.pos.presentation.expense.response.ExpenseResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/expenses")
public class ExpenseController {

    private final ExpenseService expenseService;

    public ExpenseController(ExpenseService expenseService) {
        this.expenseService = expenseService;
    }

    /**
     * 지출 기록 (POST /api/expenses)
     * 기록자에게 열린 교대가 있어야 한다.
     */
    @PostMapping
    @RequiresCapability(Capability.RECORD_EXPENSE)
    public ResponseEntity<ExpenseResponse> recordExpense(Actor actor, @Valid @RequestBody RecordExpenseRequest request) {
        var result = expenseService.recordExpense(actor.getUserId(), request.getAmount(), request.getCategory(),
                request.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(ExpenseResponse.from(result));
    }
}
