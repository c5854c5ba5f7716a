package com.myfinancehub.ledger.controller.dto;

import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record BudgetRequestDto(
        String category,
        @NotNull Integer month,
        @NotNull Integer year,
        BigDecimal amount
) {
}
