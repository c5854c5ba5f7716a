package com.myfinancehub.ledger.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record CashFlowResponseDto(String endMonth, LocalDate from, LocalDate to, List<PointDto> series) {

    public record PointDto(String month, BigDecimal income, BigDecimal expense, BigDecimal net) {
    }
}
