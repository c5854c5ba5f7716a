package com.myfinancehub.ledger.model;

import java.math.BigDecimal;
import java.time.YearMonth;

public record CashFlowPoint(YearMonth yearMonth, BigDecimal income, BigDecimal expense, BigDecimal net) {
}
