package com.myfinancehub.ledger.model;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;

public record MonthlySummary(
        String username,
        YearMonth month,
        Totals totals,
        String topCategory,
        List<BudgetProgress> budgets,
        List<CategoryTotal> highlightedCategories,
        List<TrendPoint> trend
) {
    public record Totals(BigDecimal income, BigDecimal expense, BigDecimal netSavings) {
    }
}
