package com.myfinancehub.ledger.model;

import java.math.BigDecimal;
import java.time.YearMonth;

public record TrendPoint(YearMonth yearMonth, BigDecimal total) {
}
