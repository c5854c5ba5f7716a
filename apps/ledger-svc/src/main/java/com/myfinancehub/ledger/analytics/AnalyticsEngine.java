package com.myfinancehub.ledger.analytics;

import com.myfinancehub.ledger.model.Budget;
import com.myfinancehub.ledger.model.BudgetProgress;
import com.myfinancehub.ledger.model.CashFlowPoint;
import com.myfinancehub.ledger.model.CategoryTotal;
import com.myfinancehub.ledger.model.Expense;
import com.myfinancehub.ledger.model.Income;
import com.myfinancehub.ledger.model.LedgerEntry;
import com.myfinancehub.ledger.model.TrendPoint;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Aggregations over already loaded ledger records. Stateless and free of I/O: the same input gives the
 * same output whatever order the records arrive in.
 */
@Component
public class AnalyticsEngine {

    /** Shown in summaries when there is no spending to rank. */
    public static final String NO_CATEGORY = "none";
    /** Bucket that collects every category after the top N. */
    public static final String REST_CATEGORY = "Rest";

    static final int RATIO_SCALE = 4;
    private static final int MONEY_SCALE = 2;

    private static final Comparator<Map.Entry<String, BigDecimal>> BY_TOTAL_DESC_THEN_NAME =
            Map.Entry.<String, BigDecimal>comparingByValue().reversed()
                    .thenComparing(Map.Entry.<String, BigDecimal>comparingByKey());

    public BigDecimal monthlyTotal(Collection<? extends LedgerEntry> records, YearMonth month) {
        return sum(records.stream()
                .filter(record -> YearMonth.from(record.date()).equals(month))
                .map(LedgerEntry::amount)
                .toList());
    }

    public BigDecimal netSavings(BigDecimal incomeTotal, BigDecimal expenseTotal) {
        return incomeTotal.subtract(expenseTotal).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Category with the largest summed spend. Equal totals resolve to the alphabetically first name.
     */
    public Optional<String> topCategory(Collection<Expense> expenses) {
        return totalsByCategory(expenses).entrySet().stream()
                .min(BY_TOTAL_DESC_THEN_NAME)
                .map(Map.Entry::getKey);
    }

    /**
     * One entry per budget, in category order. Spend counts only expenses of the budget's category dated
     * in the budget's month. Ratio is {@code spent / budget} clamped to [0, 1], or 0 for a zero budget.
     */
    public List<BudgetProgress> budgetProgress(Collection<Budget> budgets, Collection<Expense> expenses) {
        return budgets.stream()
                .sorted(Comparator.comparing(Budget::category)
                        .thenComparing(Budget::year)
                        .thenComparing(Budget::month))
                .map(budget -> progressOf(budget, expenses))
                .toList();
    }

    private BudgetProgress progressOf(Budget budget, Collection<Expense> expenses) {
        YearMonth period = budget.period();
        BigDecimal spent = sum(expenses.stream()
                .filter(expense -> expense.category().equals(budget.category()))
                .filter(expense -> YearMonth.from(expense.date()).equals(period))
                .map(Expense::amount)
                .toList());
        BigDecimal budgetAmount = budget.amount().setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        return new BudgetProgress(budget.category(), budgetAmount, spent, ratio(spent, budgetAmount));
    }

    static BigDecimal ratio(BigDecimal spent, BigDecimal budget) {
        if (budget.signum() <= 0) {
            return BigDecimal.ZERO.setScale(RATIO_SCALE);
        }
        BigDecimal raw = spent.divide(budget, RATIO_SCALE, RoundingMode.HALF_UP);
        if (raw.compareTo(BigDecimal.ONE) > 0) {
            return BigDecimal.ONE.setScale(RATIO_SCALE);
        }
        if (raw.signum() < 0) {
            return BigDecimal.ZERO.setScale(RATIO_SCALE);
        }
        return raw;
    }

    /**
     * Monthly totals for the {@code windowMonths} calendar months ending with the month of {@code today},
     * oldest first. Months without records are present with a zero total.
     */
    public List<TrendPoint> trendSeries(Collection<? extends LedgerEntry> records, LocalDate today, int windowMonths) {
        if (windowMonths < 1) {
            throw new IllegalArgumentException("windowMonths must be at least 1");
        }
        YearMonth last = YearMonth.from(today);
        YearMonth first = last.minusMonths(windowMonths - 1L);
        Map<YearMonth, BigDecimal> totals = records.stream()
                .filter(record -> {
                    YearMonth month = YearMonth.from(record.date());
                    return !month.isBefore(first) && !month.isAfter(last);
                })
                .collect(Collectors.groupingBy(
                        record -> YearMonth.from(record.date()),
                        Collectors.reducing(BigDecimal.ZERO, LedgerEntry::amount, BigDecimal::add)
                ));
        List<TrendPoint> series = new ArrayList<>(windowMonths);
        for (YearMonth month = first; !month.isAfter(last); month = month.plusMonths(1)) {
            series.add(new TrendPoint(month, money(totals.getOrDefault(month, BigDecimal.ZERO))));
        }
        return series;
    }

    /**
     * Spend per category, largest first; equal totals in name order.
     */
    public Map<String, BigDecimal> categoryBreakdown(Collection<Expense> expenses) {
        return totalsByCategory(expenses).entrySet().stream()
                .sorted(BY_TOTAL_DESC_THEN_NAME)
                .collect(Collectors.toMap(
                        Map.Entry::getKey,
                        Map.Entry::getValue,
                        (left, right) -> left,
                        LinkedHashMap::new
                ));
    }

    /**
     * The first {@code n} categories of {@link #categoryBreakdown}, then a single {@link #REST_CATEGORY}
     * entry summing the others when any remain.
     */
    public List<CategoryTotal> topCategoriesWithRest(Collection<Expense> expenses, int n) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be at least 1");
        }
        List<CategoryTotal> ranked = categoryBreakdown(expenses).entrySet().stream()
                .map(entry -> new CategoryTotal(entry.getKey(), entry.getValue()))
                .toList();
        if (ranked.size() <= n) {
            return ranked;
        }
        List<CategoryTotal> result = new ArrayList<>(ranked.subList(0, n));
        BigDecimal rest = sum(ranked.subList(n, ranked.size()).stream().map(CategoryTotal::total).toList());
        result.add(new CategoryTotal(REST_CATEGORY, rest));
        return result;
    }

    /**
     * Income, expense and net per calendar month present in either input, oldest first.
     */
    public List<CashFlowPoint> cashFlowSeries(Collection<Income> incomes, Collection<Expense> expenses) {
        Map<YearMonth, BigDecimal> incomeByMonth = totalsByMonth(incomes);
        Map<YearMonth, BigDecimal> expenseByMonth = totalsByMonth(expenses);
        SortedSet<YearMonth> months = new TreeSet<>(incomeByMonth.keySet());
        months.addAll(expenseByMonth.keySet());
        return months.stream()
                .map(month -> {
                    BigDecimal income = money(incomeByMonth.getOrDefault(month, BigDecimal.ZERO));
                    BigDecimal expense = money(expenseByMonth.getOrDefault(month, BigDecimal.ZERO));
                    return new CashFlowPoint(month, income, expense, netSavings(income, expense));
                })
                .toList();
    }

    private Map<String, BigDecimal> totalsByCategory(Collection<Expense> expenses) {
        return expenses.stream()
                .collect(Collectors.groupingBy(
                        Expense::category,
                        Collectors.collectingAndThen(
                                Collectors.reducing(BigDecimal.ZERO, Expense::amount, BigDecimal::add),
                                AnalyticsEngine::money)
                ));
    }

    private static Map<YearMonth, BigDecimal> totalsByMonth(Collection<? extends LedgerEntry> records) {
        return records.stream()
                .collect(Collectors.groupingBy(
                        record -> YearMonth.from(record.date()),
                        Collectors.reducing(BigDecimal.ZERO, LedgerEntry::amount, BigDecimal::add)
                ));
    }

    private static BigDecimal sum(List<BigDecimal> amounts) {
        return money(amounts.stream().reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
