package com.myfinancehub.ledger.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ExpenseRequestDto(
        String category,
        BigDecimal amount,
        LocalDate date,
        String description
) {
}
