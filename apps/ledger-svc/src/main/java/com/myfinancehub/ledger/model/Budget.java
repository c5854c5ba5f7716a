package com.myfinancehub.ledger.model;

import java.math.BigDecimal;
import java.time.YearMonth;

public record Budget(
        long id,
        String username,
        String category,
        int month,
        int year,
        BigDecimal amount
) {
    public YearMonth period() {
        return YearMonth.of(year, month);
    }
}
