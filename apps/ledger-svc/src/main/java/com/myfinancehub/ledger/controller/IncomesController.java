package com.myfinancehub.ledger.controller;

import com.myfinancehub.ledger.controller.dto.IncomeRequestDto;
import com.myfinancehub.ledger.controller.dto.IncomeResponseDto;
import com.myfinancehub.ledger.controller.dto.IncomesListResponseDto;
import com.myfinancehub.ledger.ledger.LedgerService;
import com.myfinancehub.ledger.model.DateRange;
import com.myfinancehub.ledger.model.Income;
import com.myfinancehub.ledger.model.IncomeDraft;
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
@RequestMapping("/incomes")
public class IncomesController {

    private final LedgerService ledgerService;
    private final AuthenticatedUserProvider authenticatedUserProvider;

    public IncomesController(LedgerService ledgerService, AuthenticatedUserProvider authenticatedUserProvider) {
        this.ledgerService = ledgerService;
        this.authenticatedUserProvider = authenticatedUserProvider;
    }

    @GetMapping
    public ResponseEntity<IncomesListResponseDto> listIncomes(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        String username = authenticatedUserProvider.requireCurrentUsername();
        Optional<DateRange> range = from == null && to == null ? Optional.empty() : Optional.of(new DateRange(from, to));
        List<Income> incomes = ledgerService.listIncomes(username, range);
        List<IncomeResponseDto> items = IntStream.range(0, incomes.size())
                .mapToObj(i -> map(incomes.get(i), i + 1))
                .toList();
        BigDecimal total = incomes.stream()
                .map(Income::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.ok(new IncomesListResponseDto(from, to, items.size(), total, items, traceId));
    }

    @PostMapping
    public ResponseEntity<IncomeResponseDto> addIncome(@RequestBody IncomeRequestDto request) {
        String username = authenticatedUserProvider.requireCurrentUsername();
        Income created = ledgerService.addIncome(username, request.amount(), request.date(), request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(map(created, null));
    }

    @PutMapping("/{id}")
    public ResponseEntity<IncomeResponseDto> updateIncome(@PathVariable("id") long id, @RequestBody IncomeRequestDto request) {
        String username = authenticatedUserProvider.requireCurrentUsername();
        Income updated = ledgerService.updateIncome(username, id,
                new IncomeDraft(request.amount(), request.date(), request.description()));
        return ResponseEntity.ok(map(updated, null));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteIncome(@PathVariable("id") long id) {
        ledgerService.deleteIncome(authenticatedUserProvider.requireCurrentUsername(), id);
        return ResponseEntity.noContent().build();
    }

    private IncomeResponseDto map(Income income, Integer index) {
        return new IncomeResponseDto(index, income.id(), income.amount(), income.date(), income.description());
    }
}
