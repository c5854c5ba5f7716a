package com.myfinancehub.ledger.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * {@code index} is the 1-based position in a listing and is absent outside listings. Use {@code id}
 * for updates and deletes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExpenseResponseDto(
        Integer index,
        long id,
        String category,
        BigDecimal amount,
        LocalDate date,
        String description
) {
}
