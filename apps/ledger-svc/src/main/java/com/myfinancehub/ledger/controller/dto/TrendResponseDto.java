package com.myfinancehub.ledger.controller.dto;

import java.util.List;

public record TrendResponseDto(String endMonth, int windowMonths, List<AnalyticsSummaryResponseDto.SeriesPointDto> series) {
}
