package com.myfinancehub.ledger.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record IncomeDraft(BigDecimal amount, LocalDate date, String description) {
}
