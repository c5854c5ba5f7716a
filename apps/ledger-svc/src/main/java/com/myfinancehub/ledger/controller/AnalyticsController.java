package com.myfinancehub.ledger.controller;

import com.myfinancehub.ledger.analytics.DashboardService;
import com.myfinancehub.ledger.controller.dto.AnalyticsSummaryResponseDto;
import com.myfinancehub.ledger.controller.dto.CashFlowResponseDto;
import com.myfinancehub.ledger.controller.dto.CategoriesResponseDto;
import com.myfinancehub.ledger.controller.dto.TrendResponseDto;
import com.myfinancehub.ledger.model.CategoryTotal;
import com.myfinancehub.ledger.model.DateRange;
import com.myfinancehub.ledger.model.MonthlySummary;
import com.myfinancehub.ledger.model.TrendPoint;
import com.myfinancehub.ledger.security.AuthenticatedUserProvider;
import com.myfinancehub.ledger.security.RequestContextHolder;
import com.myfinancehub.ledger.session.LedgerSession;
import com.myfinancehub.ledger.session.SessionService;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only analytics for one reporting month ({@code month=yyyy-MM}, default the current month).
 * Categories and cash flow also take an explicit inclusive {@code from}/{@code to} range, which
 * replaces the month. The summary payload is also what the monthly e-mail is built from.
 */
@RestController
@RequestMapping("/analytics")
public class AnalyticsController {

    private final DashboardService dashboardService;
    private final SessionService sessionService;
    private final AuthenticatedUserProvider authenticatedUserProvider;

    public AnalyticsController(DashboardService dashboardService,
                               SessionService sessionService,
                               AuthenticatedUserProvider authenticatedUserProvider) {
        this.dashboardService = dashboardService;
        this.sessionService = sessionService;
        this.authenticatedUserProvider = authenticatedUserProvider;
    }

    @GetMapping("/summary")
    public ResponseEntity<AnalyticsSummaryResponseDto> getSummary(@RequestParam(value = "month", required = false) String month) {
        MonthlySummary summary = dashboardService.summarize(session(month));
        return ResponseEntity.ok(map(summary));
    }

    @GetMapping("/trend")
    public ResponseEntity<TrendResponseDto> getTrend(
            @RequestParam(value = "month", required = false) String month,
            @RequestParam(value = "window", required = false) Integer window
    ) {
        LedgerSession session = session(month);
        List<TrendPoint> trend = dashboardService.trend(session, Optional.ofNullable(window));
        return ResponseEntity.ok(new TrendResponseDto(session.period().toString(), trend.size(), mapTrend(trend)));
    }

    @GetMapping("/categories")
    public ResponseEntity<CategoriesResponseDto> getCategories(
            @RequestParam(value = "month", required = false) String month,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        LedgerSession session = session(month);
        DashboardService.CategoryView view = dashboardService.categories(session, range(from, to));
        return ResponseEntity.ok(new CategoriesResponseDto(
                session.period().toString(),
                from,
                to,
                mapCategories(view.all()),
                mapCategories(view.highlighted())
        ));
    }

    @GetMapping("/cash-flow")
    public ResponseEntity<CashFlowResponseDto> getCashFlow(
            @RequestParam(value = "month", required = false) String month,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        LedgerSession session = session(month);
        List<CashFlowResponseDto.PointDto> series = dashboardService.cashFlow(session, range(from, to)).stream()
                .map(point -> new CashFlowResponseDto.PointDto(
                        point.yearMonth().toString(), point.income(), point.expense(), point.net()))
                .toList();
        return ResponseEntity.ok(new CashFlowResponseDto(session.period().toString(), from, to, series));
    }

    // one bound without the other is INVALID_RANGE, raised by DateRange
    static Optional<DateRange> range(LocalDate from, LocalDate to) {
        if (from == null && to == null) {
            return Optional.empty();
        }
        return Optional.of(new DateRange(from, to));
    }

    private LedgerSession session(String month) {
        return sessionService.resume(authenticatedUserProvider.requireCurrentUsername(), SessionService.parsePeriod(month));
    }

    private AnalyticsSummaryResponseDto map(MonthlySummary summary) {
        return new AnalyticsSummaryResponseDto(
                summary.username(),
                summary.month().toString(),
                new AnalyticsSummaryResponseDto.Totals(
                        summary.totals().income(), summary.totals().expense(), summary.totals().netSavings()),
                summary.topCategory(),
                summary.budgets().stream().map(BudgetsController::map).toList(),
                mapCategories(summary.highlightedCategories()),
                mapTrend(summary.trend()),
                RequestContextHolder.traceId().orElse(null)
        );
    }

    private static List<AnalyticsSummaryResponseDto.CategoryTotalDto> mapCategories(List<CategoryTotal> totals) {
        return totals.stream()
                .map(total -> new AnalyticsSummaryResponseDto.CategoryTotalDto(total.category(), total.total()))
                .toList();
    }

    private static List<AnalyticsSummaryResponseDto.SeriesPointDto> mapTrend(List<TrendPoint> trend) {
        return trend.stream()
                .map(point -> new AnalyticsSummaryResponseDto.SeriesPointDto(point.yearMonth().toString(), point.total()))
                .toList();
    }
}
