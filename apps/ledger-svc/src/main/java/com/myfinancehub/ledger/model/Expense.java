package com.myfinancehub.ledger.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record Expense(
        long id,
        String username,
        String category,
        BigDecimal amount,
        LocalDate date,
        String description
) implements LedgerEntry {
}
