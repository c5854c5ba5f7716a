package com.myfinancehub.ledger.controller;

import com.myfinancehub.ledger.controller.dto.CategoryListResponseDto;
import com.myfinancehub.ledger.controller.dto.ExpenseRequestDto;
import com.myfinancehub.ledger.controller.dto.ExpenseResponseDto;
import com.myfinancehub.ledger.controller.dto.ExpensesListResponseDto;
import com.myfinancehub.ledger.ledger.CategoryPolicy;
import com.myfinancehub.ledger.ledger.LedgerService;
import com.myfinancehub.ledger.model.DateRange;
import com.myfinancehub.ledger.model.Expense;
import com.myfinancehub.ledger.model.ExpenseDraft;
import com.myfinancehub.ledger.security.AuthenticatedUserProvider;
import com.myfinancehub.ledger.security.RequestContextHolder;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/expenses")
public class ExpensesController {

    private final LedgerService ledgerService;
    private final CategoryPolicy categoryPolicy;
    private final AuthenticatedUserProvider authenticatedUserProvider;

    public ExpensesController(LedgerService ledgerService,
                              CategoryPolicy categoryPolicy,
                              AuthenticatedUserProvider authenticatedUserProvider) {
        this.ledgerService = ledgerService;
        this.categoryPolicy = categoryPolicy;
        this.authenticatedUserProvider = authenticatedUserProvider;
    }

    /**
     * Ordered by date, then id. {@code from} and {@code to} are inclusive and must be given together.
     * {@code category} keeps one category; {@code q} searches descriptions ignoring case. Index, count
     * and total describe the filtered listing.
     */
    @GetMapping
    public ResponseEntity<ExpensesListResponseDto> listExpenses(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "category", required = false) String category,
            @RequestParam(value = "q", required = false) String query
    ) {
        String username = authenticatedUserProvider.requireCurrentUsername();
        Optional<DateRange> range = from == null && to == null ? Optional.empty() : Optional.of(new DateRange(from, to));
        List<Expense> expenses = ledgerService.listExpenses(
                username, range, Optional.ofNullable(category), Optional.ofNullable(query));
        List<ExpenseResponseDto> items = IntStream.range(0, expenses.size())
                .mapToObj(i -> map(expenses.get(i), i + 1))
                .toList();
        BigDecimal total = expenses.stream()
                .map(Expense::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.ok(new ExpensesListResponseDto(from, to, items.size(), total, items, traceId));
    }

    @GetMapping("/categories")
    public ResponseEntity<CategoryListResponseDto> listCategories() {
        return ResponseEntity.ok(new CategoryListResponseDto(categoryPolicy.restricted(), categoryPolicy.categories()));
    }

    @PostMapping
    public ResponseEntity<ExpenseResponseDto> addExpense(@RequestBody ExpenseRequestDto request) {
        String username = authenticatedUserProvider.requireCurrentUsername();
        Expense created = ledgerService.addExpense(username, request.category(), request.amount(), request.date(), request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(map(created, null));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ExpenseResponseDto> updateExpense(@PathVariable("id") long id, @RequestBody ExpenseRequestDto request) {
        String username = authenticatedUserProvider.requireCurrentUsername();
        Expense updated = ledgerService.updateExpense(username, id,
                new ExpenseDraft(request.category(), request.amount(), request.date(), request.description()));
        return ResponseEntity.ok(map(updated, null));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteExpense(@PathVariable("id") long id) {
        ledgerService.deleteExpense(authenticatedUserProvider.requireCurrentUsername(), id);
        return ResponseEntity.noContent().build();
    }

    private ExpenseResponseDto map(Expense expense, Integer index) {
        return new ExpenseResponseDto(
                index,
                expense.id(),
                expense.category(),
                expense.amount(),
                expense.date(),
                expense.description()
        );
    }
}
