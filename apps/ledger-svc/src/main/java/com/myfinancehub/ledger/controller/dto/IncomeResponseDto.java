package com.myfinancehub.ledger.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.time.LocalDate;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IncomeResponseDto(
        Integer index,
        long id,
        BigDecimal amount,
        LocalDate date,
        String description
) {
}
