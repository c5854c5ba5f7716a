package com.myfinancehub.ledger.controller.dto;

import java.math.BigDecimal;
import java.util.List;

public record BudgetProgressResponseDto(String month, List<ProgressDto> progress) {

    public record ProgressDto(String category, BigDecimal budget, BigDecimal spent, BigDecimal ratio) {
    }
}
