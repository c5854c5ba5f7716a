package com.myfinancehub.ledger.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record IncomeRequestDto(BigDecimal amount, LocalDate date, String description) {
}
