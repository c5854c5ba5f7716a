package com.myfinancehub.ledger.analytics;

import com.myfinancehub.ledger.config.LedgerProperties;
import com.myfinancehub.ledger.ledger.BudgetService;
import com.myfinancehub.ledger.ledger.LedgerService;
import com.myfinancehub.ledger.model.Budget;
import com.myfinancehub.ledger.model.BudgetProgress;
import com.myfinancehub.ledger.model.CashFlowPoint;
import com.myfinancehub.ledger.model.CategoryTotal;
import com.myfinancehub.ledger.model.DateRange;
import com.myfinancehub.ledger.model.Expense;
import com.myfinancehub.ledger.model.Income;
import com.myfinancehub.ledger.model.MonthlySummary;
import com.myfinancehub.ledger.model.TrendPoint;
import com.myfinancehub.ledger.session.LedgerSession;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Loads a user's records for a reporting month and feeds them through {@link AnalyticsEngine}.
 * Trends and cash flow cover the configured window ending with the session's month.
 */
@Service
public class DashboardService {

    static final int MAX_TREND_WINDOW_MONTHS = 120;

    private final LedgerService ledgerService;
    private final BudgetService budgetService;
    private final AnalyticsEngine engine;
    private final int topCategories;
    private final int trendWindowMonths;

    public DashboardService(LedgerService ledgerService,
                            BudgetService budgetService,
                            AnalyticsEngine engine,
                            LedgerProperties properties) {
        this.ledgerService = ledgerService;
        this.budgetService = budgetService;
        this.engine = engine;
        this.topCategories = properties.analytics().topCategories();
        this.trendWindowMonths = properties.analytics().trendWindowMonths();
    }

    @Transactional(readOnly = true)
    public MonthlySummary summarize(LedgerSession session) {
        YearMonth period = session.period();
        DateRange window = window(period, trendWindowMonths);
        List<Expense> expenses = ledgerService.listExpenses(session.username(), Optional.of(window));
        List<Income> incomes = ledgerService.listIncomes(session.username(), Optional.of(window));
        List<Expense> monthExpenses = inMonth(expenses, period);

        BigDecimal incomeTotal = engine.monthlyTotal(incomes, period);
        BigDecimal expenseTotal = engine.monthlyTotal(expenses, period);
        List<Budget> budgets = budgetService.listBudgets(session.username(), period.getMonthValue(), period.getYear());

        return new MonthlySummary(
                session.username(),
                period,
                new MonthlySummary.Totals(incomeTotal, expenseTotal, engine.netSavings(incomeTotal, expenseTotal)),
                engine.topCategory(monthExpenses).orElse(AnalyticsEngine.NO_CATEGORY),
                engine.budgetProgress(budgets, monthExpenses),
                engine.topCategoriesWithRest(monthExpenses, topCategories),
                engine.trendSeries(expenses, period.atEndOfMonth(), trendWindowMonths)
        );
    }

    @Transactional(readOnly = true)
    public List<BudgetProgress> budgetProgress(LedgerSession session) {
        YearMonth period = session.period();
        List<Budget> budgets = budgetService.listBudgets(session.username(), period.getMonthValue(), period.getYear());
        List<Expense> expenses = ledgerService.listExpenses(session.username(), Optional.of(window(period, 1)));
        return engine.budgetProgress(budgets, expenses);
    }

    @Transactional(readOnly = true)
    public List<TrendPoint> trend(LedgerSession session, Optional<Integer> windowMonths) {
        int months = windowMonths.orElse(trendWindowMonths);
        if (months < 1 || months > MAX_TREND_WINDOW_MONTHS) {
            throw new IllegalArgumentException("window must be between 1 and " + MAX_TREND_WINDOW_MONTHS + " months");
        }
        YearMonth period = session.period();
        List<Expense> expenses = ledgerService.listExpenses(session.username(), Optional.of(window(period, months)));
        return engine.trendSeries(expenses, period.atEndOfMonth(), months);
    }

    /**
     * Full breakdown plus the top-N-and-rest view shown on the dashboard, over {@code range} when
     * given and the session month otherwise.
     */
    @Transactional(readOnly = true)
    public CategoryView categories(LedgerSession session, Optional<DateRange> range) {
        DateRange window = range.orElseGet(() -> window(session.period(), 1));
        List<Expense> expenses = ledgerService.listExpenses(session.username(), Optional.of(window));
        List<CategoryTotal> all = engine.categoryBreakdown(expenses).entrySet().stream()
                .map(entry -> new CategoryTotal(entry.getKey(), entry.getValue()))
                .toList();
        return new CategoryView(all, engine.topCategoriesWithRest(expenses, topCategories));
    }

    /**
     * Monthly income against expenses over {@code range} when given, else the trend window ending
     * with the session month.
     */
    @Transactional(readOnly = true)
    public List<CashFlowPoint> cashFlow(LedgerSession session, Optional<DateRange> range) {
        DateRange window = range.orElseGet(() -> window(session.period(), trendWindowMonths));
        List<Income> incomes = ledgerService.listIncomes(session.username(), Optional.of(window));
        List<Expense> expenses = ledgerService.listExpenses(session.username(), Optional.of(window));
        return engine.cashFlowSeries(incomes, expenses);
    }

    static DateRange window(YearMonth last, int months) {
        return new DateRange(last.minusMonths(months - 1L).atDay(1), last.atEndOfMonth());
    }

    private static List<Expense> inMonth(List<Expense> expenses, YearMonth period) {
        return expenses.stream()
                .filter(expense -> YearMonth.from(expense.date()).equals(period))
                .toList();
    }

    public record CategoryView(List<CategoryTotal> all, List<CategoryTotal> highlighted) {
    }
}
