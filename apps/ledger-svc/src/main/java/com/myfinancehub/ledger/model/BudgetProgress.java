package com.myfinancehub.ledger.model;

import java.math.BigDecimal;

/**
 * Spend measured against one category budget. {@code ratio} is always within [0, 1].
 */
public record BudgetProgress(String category, BigDecimal budgetAmount, BigDecimal spentAmount, BigDecimal ratio) {
}
