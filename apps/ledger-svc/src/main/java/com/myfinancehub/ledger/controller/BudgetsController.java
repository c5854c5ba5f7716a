package com.myfinancehub.ledger.controller;

import com.myfinancehub.ledger.analytics.DashboardService;
import com.myfinancehub.ledger.controller.dto.BudgetProgressResponseDto;
import com.myfinancehub.ledger.controller.dto.BudgetRequestDto;
import com.myfinancehub.ledger.controller.dto.BudgetsResponseDto;
import com.myfinancehub.ledger.ledger.BudgetService;
import com.myfinancehub.ledger.model.Budget;
import com.myfinancehub.ledger.model.BudgetProgress;
import com.myfinancehub.ledger.security.AuthenticatedUserProvider;
import com.myfinancehub.ledger.session.LedgerSession;
import com.myfinancehub.ledger.session.SessionService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.stream.IntStream;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/budgets")
public class BudgetsController {

    private final BudgetService budgetService;
    private final DashboardService dashboardService;
    private final SessionService sessionService;
    private final AuthenticatedUserProvider authenticatedUserProvider;

    public BudgetsController(BudgetService budgetService,
                             DashboardService dashboardService,
                             SessionService sessionService,
                             AuthenticatedUserProvider authenticatedUserProvider) {
        this.budgetService = budgetService;
        this.dashboardService = dashboardService;
        this.sessionService = sessionService;
        this.authenticatedUserProvider = authenticatedUserProvider;
    }

    @GetMapping
    public ResponseEntity<BudgetsResponseDto> listBudgets(@RequestParam(value = "month", required = false) String month) {
        LedgerSession session = session(month);
        List<Budget> budgets = budgetService.listBudgets(
                session.username(), session.period().getMonthValue(), session.period().getYear());
        List<BudgetsResponseDto.BudgetDto> items = IntStream.range(0, budgets.size())
                .mapToObj(i -> map(budgets.get(i), i + 1))
                .toList();
        return ResponseEntity.ok(new BudgetsResponseDto(session.period().toString(), items));
    }

    @PutMapping
    public ResponseEntity<BudgetsResponseDto.BudgetDto> setBudget(@RequestBody @Valid BudgetRequestDto request) {
        String username = authenticatedUserProvider.requireCurrentUsername();
        Budget budget = budgetService.setBudget(username, request.category(), request.month(), request.year(), request.amount());
        return ResponseEntity.ok(map(budget, null));
    }

    @GetMapping("/progress")
    public ResponseEntity<BudgetProgressResponseDto> progress(@RequestParam(value = "month", required = false) String month) {
        LedgerSession session = session(month);
        List<BudgetProgressResponseDto.ProgressDto> progress = dashboardService.budgetProgress(session).stream()
                .map(BudgetsController::map)
                .toList();
        return ResponseEntity.ok(new BudgetProgressResponseDto(session.period().toString(), progress));
    }

    static BudgetProgressResponseDto.ProgressDto map(BudgetProgress progress) {
        return new BudgetProgressResponseDto.ProgressDto(
                progress.category(),
                progress.budgetAmount(),
                progress.spentAmount(),
                progress.ratio()
        );
    }

    private LedgerSession session(String month) {
        return sessionService.resume(authenticatedUserProvider.requireCurrentUsername(), SessionService.parsePeriod(month));
    }

    private BudgetsResponseDto.BudgetDto map(Budget budget, Integer index) {
        return new BudgetsResponseDto.BudgetDto(
                index,
                budget.id(),
                budget.category(),
                budget.month(),
                budget.year(),
                budget.amount()
        );
    }
}
