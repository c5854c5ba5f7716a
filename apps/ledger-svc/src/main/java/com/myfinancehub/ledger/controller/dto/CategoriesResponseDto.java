package com.myfinancehub.ledger.controller.dto;

import java.time.LocalDate;
import java.util.List;

/**
 * {@code from} and {@code to} are null unless the breakdown was requested for an explicit range.
 */
public record CategoriesResponseDto(
        String month,
        LocalDate from,
        LocalDate to,
        List<AnalyticsSummaryResponseDto.CategoryTotalDto> categories,
        List<AnalyticsSummaryResponseDto.CategoryTotalDto> highlighted
) {
}
