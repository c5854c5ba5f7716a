package com.myfinancehub.ledger.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record Income(
        long id,
        String username,
        BigDecimal amount,
        LocalDate date,
        String description
) implements LedgerEntry {
}
