package com.myfinancehub.ledger.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record ExpensesListResponseDto(
        LocalDate from,
        LocalDate to,
        int count,
        BigDecimal total,
        List<ExpenseResponseDto> expenses,
        String traceId
) {
}
