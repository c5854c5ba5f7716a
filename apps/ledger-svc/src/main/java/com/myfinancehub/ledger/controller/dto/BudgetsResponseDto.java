package com.myfinancehub.ledger.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.util.List;

public record BudgetsResponseDto(String month, List<BudgetDto> budgets) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record BudgetDto(Integer index, long id, String category, int month, int year, BigDecimal amount) {
    }
}
