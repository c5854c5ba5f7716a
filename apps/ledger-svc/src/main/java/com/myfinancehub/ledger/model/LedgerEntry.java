package com.myfinancehub.ledger.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Common view of a dated money movement, shared by {@link Expense} and {@link Income}.
 */
public interface LedgerEntry {

    BigDecimal amount();

    LocalDate date();
}
