package com.myfinancehub.ledger.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Replacement values for every editable field of an expense.
 */
public record ExpenseDraft(String category, BigDecimal amount, LocalDate date, String description) {
}
