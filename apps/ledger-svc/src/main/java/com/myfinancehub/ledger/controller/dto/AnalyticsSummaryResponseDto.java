package com.myfinancehub.ledger.controller.dto;

import java.math.BigDecimal;
import java.util.List;

public record AnalyticsSummaryResponseDto(
        String username,
        String month,
        Totals totals,
        String topCategory,
        List<BudgetProgressResponseDto.ProgressDto> budgets,
        List<CategoryTotalDto> highlightedCategories,
        List<SeriesPointDto> trend,
        String traceId
) {
    public record Totals(BigDecimal income, BigDecimal expense, BigDecimal netSavings) {
    }

    public record CategoryTotalDto(String category, BigDecimal total) {
    }

    public record SeriesPointDto(String month, BigDecimal total) {
    }
}
