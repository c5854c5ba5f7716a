package com.myfinancehub.ledger.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.myfinancehub.ledger.model.Budget;
import com.myfinancehub.ledger.model.BudgetProgress;
import com.myfinancehub.ledger.model.CashFlowPoint;
import com.myfinancehub.ledger.model.CategoryTotal;
import com.myfinancehub.ledger.model.Expense;
import com.myfinancehub.ledger.model.Income;
import com.myfinancehub.ledger.model.TrendPoint;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class AnalyticsEngineTest {

    private final AnalyticsEngine engine = new AnalyticsEngine();
    private final AtomicLong ids = new AtomicLong();

    @Test
    void monthlyTotalOfNothingIsZero() {
        assertThat(engine.monthlyTotal(List.<Expense>of(), YearMonth.of(2024, 1))).isEqualByComparingTo("0");
    }

    @Test
    void monthlyTotalSumsOnlyTheRequestedMonth() {
        List<Expense> expenses = List.of(
                expense("Food", "100", "2024-01-03"),
                expense("Food", "50", "2024-01-31"),
                expense("Food", "30", "2024-02-01")
        );

        assertThat(engine.monthlyTotal(expenses, YearMonth.of(2024, 1))).isEqualByComparingTo("150");
        assertThat(engine.monthlyTotal(expenses, YearMonth.of(2024, 2))).isEqualByComparingTo("30");
    }

    @Test
    void monthlyTotalWorksForIncomes() {
        List<Income> incomes = List.of(income("2500", "2024-03-25"), income("120.50", "2024-03-02"));

        assertThat(engine.monthlyTotal(incomes, YearMonth.of(2024, 3))).isEqualByComparingTo("2620.50");
    }

    @Test
    void netSavingsMayBeNegative() {
        assertThat(engine.netSavings(new BigDecimal("1000"), new BigDecimal("1250.75")))
                .isEqualByComparingTo("-250.75");
    }

    @Test
    void topCategoryBreaksTiesAlphabetically() {
        List<Expense> expenses = new ArrayList<>(List.of(
                expense("Transport", "120", "2024-05-01"),
                expense("Food", "70", "2024-05-02"),
                expense("Food", "50", "2024-05-03")
        ));

        for (int run = 0; run < 20; run++) {
            Collections.shuffle(expenses, new Random(run));
            assertThat(engine.topCategory(expenses)).contains("Food");
        }
    }

    @Test
    void topCategoryPicksLargestTotal() {
        List<Expense> expenses = List.of(
                expense("Food", "40", "2024-05-01"),
                expense("Utilities", "95", "2024-05-02"),
                expense("Food", "50", "2024-05-03")
        );

        assertThat(engine.topCategory(expenses)).contains("Utilities");
    }

    @Test
    void topCategoryIsEmptyWithoutExpenses() {
        assertThat(engine.topCategory(List.of())).isEmpty();
    }

    @Test
    void budgetProgressClampsAndSkipsCategoriesWithoutBudget() {
        List<Expense> expenses = List.of(
                expense("Food", "200", "2024-05-01"),
                expense("Transport", "50", "2024-05-15")
        );
        List<Budget> budgets = List.of(budget("Food", 5, 2024, "150"));

        List<BudgetProgress> progress = engine.budgetProgress(budgets, expenses);

        assertThat(progress).hasSize(1);
        assertThat(progress.get(0).category()).isEqualTo("Food");
        assertThat(progress.get(0).spentAmount()).isEqualByComparingTo("200");
        assertThat(progress.get(0).ratio()).isEqualByComparingTo("1");
    }

    @Test
    void budgetProgressWithZeroBudgetHasZeroRatio() {
        List<BudgetProgress> progress = engine.budgetProgress(
                List.of(budget("Food", 5, 2024, "0")),
                List.of(expense("Food", "50", "2024-05-10")));

        assertThat(progress.get(0).spentAmount()).isEqualByComparingTo("50");
        assertThat(progress.get(0).ratio()).isEqualByComparingTo("0");
    }

    @Test
    void budgetProgressCountsOnlyTheBudgetMonth() {
        List<Expense> expenses = List.of(
                expense("Food", "30", "2024-05-10"),
                expense("Food", "500", "2024-04-30"),
                expense("Food", "500", "2023-05-10")
        );

        BudgetProgress progress = engine.budgetProgress(List.of(budget("Food", 5, 2024, "120")), expenses).get(0);

        assertThat(progress.spentAmount()).isEqualByComparingTo("30");
        assertThat(progress.ratio()).isEqualByComparingTo("0.25");
    }

    @Test
    void budgetProgressIsOrderedByCategory() {
        List<Budget> budgets = List.of(
                budget("Utilities", 5, 2024, "100"),
                budget("Entertainment", 5, 2024, "100"),
                budget("Food", 5, 2024, "100")
        );

        assertThat(engine.budgetProgress(budgets, List.of()))
                .extracting(BudgetProgress::category)
                .containsExactly("Entertainment", "Food", "Utilities");
    }

    @Test
    void ratioIsRoundedToFourPlaces() {
        assertThat(AnalyticsEngine.ratio(new BigDecimal("1.00"), new BigDecimal("3.00"))).isEqualTo(new BigDecimal("0.3333"));
    }

    @Test
    void trendSeriesIsDenseAndChronological() {
        List<Expense> expenses = List.of(
                expense("Food", "10", "2024-01-15"),
                expense("Food", "20", "2024-03-01"),
                expense("Food", "5", "2024-03-31"),
                expense("Food", "999", "2023-09-30"),
                expense("Food", "999", "2024-04-01")
        );

        List<TrendPoint> trend = engine.trendSeries(expenses, LocalDate.of(2024, 3, 10), 6);

        assertThat(trend).extracting(TrendPoint::yearMonth).containsExactly(
                YearMonth.of(2023, 10), YearMonth.of(2023, 11), YearMonth.of(2023, 12),
                YearMonth.of(2024, 1), YearMonth.of(2024, 2), YearMonth.of(2024, 3));
        assertThat(trend.get(0).total()).isEqualByComparingTo("0");
        assertThat(trend.get(3).total()).isEqualByComparingTo("10");
        assertThat(trend.get(4).total()).isEqualByComparingTo("0");
        assertThat(trend.get(5).total()).isEqualByComparingTo("25");
    }

    @Test
    void trendSeriesRejectsEmptyWindow() {
        assertThatThrownBy(() -> engine.trendSeries(List.of(), LocalDate.of(2024, 3, 1), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("windowMonths");
    }

    @Test
    void categoryBreakdownOrdersByTotalThenName() {
        List<Expense> expenses = List.of(
                expense("Transport", "40", "2024-05-01"),
                expense("Food", "90", "2024-05-02"),
                expense("Health", "40", "2024-05-03"),
                expense("Food", "10", "2024-05-04")
        );

        Map<String, BigDecimal> breakdown = engine.categoryBreakdown(expenses);

        assertThat(breakdown.keySet()).containsExactly("Food", "Health", "Transport");
        assertThat(breakdown.get("Food")).isEqualByComparingTo("100");
    }

    @Test
    void topCategoriesWithRestAggregatesTheTail() {
        List<Expense> expenses = List.of(
                expense("Food", "100", "2024-05-01"),
                expense("Transport", "80", "2024-05-01"),
                expense("Utilities", "60", "2024-05-01"),
                expense("Health", "15", "2024-05-01"),
                expense("Other", "5", "2024-05-01")
        );

        List<CategoryTotal> top = engine.topCategoriesWithRest(expenses, 3);

        assertThat(top).extracting(CategoryTotal::category)
                .containsExactly("Food", "Transport", "Utilities", AnalyticsEngine.REST_CATEGORY);
        assertThat(top.get(3).total()).isEqualByComparingTo("20");
    }

    @Test
    void topCategoriesWithRestOmitsEmptyRest() {
        List<Expense> expenses = List.of(
                expense("Food", "100", "2024-05-01"),
                expense("Transport", "80", "2024-05-01")
        );

        assertThat(engine.topCategoriesWithRest(expenses, 3))
                .extracting(CategoryTotal::category)
                .containsExactly("Food", "Transport");
    }

    @Test
    void cashFlowCoversMonthsFromEitherSide() {
        List<Income> incomes = List.of(income("3000", "2024-01-25"), income("3000", "2024-03-25"));
        List<Expense> expenses = List.of(expense("Food", "400", "2024-02-10"), expense("Food", "3500", "2024-03-02"));

        List<CashFlowPoint> flow = engine.cashFlowSeries(incomes, expenses);

        assertThat(flow).extracting(CashFlowPoint::yearMonth)
                .containsExactly(YearMonth.of(2024, 1), YearMonth.of(2024, 2), YearMonth.of(2024, 3));
        assertThat(flow.get(1).income()).isEqualByComparingTo("0");
        assertThat(flow.get(1).net()).isEqualByComparingTo("-400");
        assertThat(flow.get(2).net()).isEqualByComparingTo("-500");
    }

    private Expense expense(String category, String amount, String date) {
        return new Expense(ids.incrementAndGet(), "alice", category, new BigDecimal(amount), LocalDate.parse(date), null);
    }

    private Income income(String amount, String date) {
        return new Income(ids.incrementAndGet(), "alice", new BigDecimal(amount), LocalDate.parse(date), null);
    }

    private Budget budget(String category, int month, int year, String amount) {
        return new Budget(ids.incrementAndGet(), "alice", category, month, year, new BigDecimal(amount));
    }
}
