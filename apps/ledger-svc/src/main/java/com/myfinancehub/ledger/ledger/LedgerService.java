package com.myfinancehub.ledger.ledger;

import com.myfinancehub.ledger.entity.ExpenseEntity;
import com.myfinancehub.ledger.entity.IncomeEntity;
import com.myfinancehub.ledger.error.ErrorCode;
import com.myfinancehub.ledger.error.NotFoundException;
import com.myfinancehub.ledger.error.ValidationException;
import com.myfinancehub.ledger.model.DateRange;
import com.myfinancehub.ledger.model.Expense;
import com.myfinancehub.ledger.model.ExpenseDraft;
import com.myfinancehub.ledger.model.Income;
import com.myfinancehub.ledger.model.IncomeDraft;
import com.myfinancehub.ledger.repository.JpaExpenseRepository;
import com.myfinancehub.ledger.repository.JpaIncomeRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Expense and income records of one user. Every method takes the owner explicitly and never reads or
 * writes a row owned by anyone else; a foreign id is reported as {@link NotFoundException}.
 */
@Service
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    public static final int MAX_DESCRIPTION_LENGTH = 255;

    private final JpaExpenseRepository expenseRepository;
    private final JpaIncomeRepository incomeRepository;
    private final CategoryPolicy categoryPolicy;
    private final Clock clock;

    @Autowired
    public LedgerService(JpaExpenseRepository expenseRepository,
                         JpaIncomeRepository incomeRepository,
                         CategoryPolicy categoryPolicy) {
        this(expenseRepository, incomeRepository, categoryPolicy, Clock.systemUTC());
    }

    LedgerService(JpaExpenseRepository expenseRepository,
                  JpaIncomeRepository incomeRepository,
                  CategoryPolicy categoryPolicy,
                  Clock clock) {
        this.expenseRepository = expenseRepository;
        this.incomeRepository = incomeRepository;
        this.categoryPolicy = categoryPolicy;
        this.clock = clock;
    }

    // --- expenses ---

    @Transactional
    public Expense addExpense(String username, String category, BigDecimal amount, LocalDate date, String description) {
        ExpenseDraft draft = validate(new ExpenseDraft(category, amount, date, description));
        ExpenseEntity saved = expenseRepository.save(new ExpenseEntity(
                username,
                draft.category(),
                draft.amount(),
                LedgerDates.format(draft.date()),
                draft.description(),
                clock.instant()
        ));
        log.debug("Expense {} added: {} {}", saved.getId(), draft.category(), draft.amount());
        return new Expense(saved.getId(), username, draft.category(), draft.amount(), draft.date(), draft.description());
    }

    @Transactional(readOnly = true)
    public List<Expense> listExpenses(String username, Optional<DateRange> range) {
        List<ExpenseEntity> rows = range
                .map(r -> expenseRepository.findByOwnerAndRange(username, LedgerDates.format(r.from()), LedgerDates.format(r.to())))
                .orElseGet(() -> expenseRepository.findByOwner(username));
        return rows.stream()
                .map(this::toExpense)
                .flatMap(Optional::stream)
                .filter(expense -> range.map(r -> r.contains(expense.date())).orElse(true))
                .sorted(Comparator.comparing(Expense::date).thenComparingLong(Expense::id))
                .toList();
    }

    /**
     * {@link #listExpenses(String, Optional)} narrowed to one category (exact match after trimming)
     * and to descriptions containing {@code text}, ignoring case. Blank filters are ignored; an
     * expense without a description never matches a text filter.
     */
    @Transactional(readOnly = true)
    public List<Expense> listExpenses(String username,
                                      Optional<DateRange> range,
                                      Optional<String> category,
                                      Optional<String> text) {
        Optional<String> wantedCategory = category.map(String::trim).filter(value -> !value.isEmpty());
        Optional<String> needle = text.map(String::trim)
                .filter(value -> !value.isEmpty())
                .map(value -> value.toLowerCase(Locale.ROOT));
        return listExpenses(username, range).stream()
                .filter(expense -> wantedCategory.map(expense.category()::equals).orElse(true))
                .filter(expense -> needle.map(n -> expense.description() != null
                        && expense.description().toLowerCase(Locale.ROOT).contains(n)).orElse(true))
                .toList();
    }

    @Transactional
    public Expense updateExpense(String username, long id, ExpenseDraft draft) {
        ExpenseDraft valid = validate(draft);
        ExpenseEntity entity = expenseRepository.findOwned(id, username)
                .orElseThrow(() -> new NotFoundException("expense " + id + " not found"));
        entity.rewrite(valid.category(), valid.amount(), LedgerDates.format(valid.date()), valid.description());
        return new Expense(entity.getId(), username, valid.category(), valid.amount(), valid.date(), valid.description());
    }

    @Transactional
    public void deleteExpense(String username, long id) {
        if (expenseRepository.deleteOwned(id, username) == 0) {
            throw new NotFoundException("expense " + id + " not found");
        }
        log.debug("Expense {} deleted", id);
    }

    // --- incomes ---

    @Transactional
    public Income addIncome(String username, BigDecimal amount, LocalDate date, String description) {
        IncomeDraft draft = validate(new IncomeDraft(amount, date, description));
        IncomeEntity saved = incomeRepository.save(new IncomeEntity(
                username,
                draft.amount(),
                LedgerDates.format(draft.date()),
                draft.description(),
                clock.instant()
        ));
        log.debug("Income {} added: {}", saved.getId(), draft.amount());
        return new Income(saved.getId(), username, draft.amount(), draft.date(), draft.description());
    }

    @Transactional(readOnly = true)
    public List<Income> listIncomes(String username, Optional<DateRange> range) {
        List<IncomeEntity> rows = range
                .map(r -> incomeRepository.findByOwnerAndRange(username, LedgerDates.format(r.from()), LedgerDates.format(r.to())))
                .orElseGet(() -> incomeRepository.findByOwner(username));
        return rows.stream()
                .map(this::toIncome)
                .flatMap(Optional::stream)
                .filter(income -> range.map(r -> r.contains(income.date())).orElse(true))
                .sorted(Comparator.comparing(Income::date).thenComparingLong(Income::id))
                .toList();
    }

    @Transactional
    public Income updateIncome(String username, long id, IncomeDraft draft) {
        IncomeDraft valid = validate(draft);
        IncomeEntity entity = incomeRepository.findOwned(id, username)
                .orElseThrow(() -> new NotFoundException("income " + id + " not found"));
        entity.rewrite(valid.amount(), LedgerDates.format(valid.date()), valid.description());
        return new Income(entity.getId(), username, valid.amount(), valid.date(), valid.description());
    }

    @Transactional
    public void deleteIncome(String username, long id) {
        if (incomeRepository.deleteOwned(id, username) == 0) {
            throw new NotFoundException("income " + id + " not found");
        }
        log.debug("Income {} deleted", id);
    }

    // --- validation and mapping ---

    private ExpenseDraft validate(ExpenseDraft draft) {
        Objects.requireNonNull(draft, "draft");
        String category = categoryPolicy.requireAllowed(draft.category());
        BigDecimal amount = LedgerAmounts.require(draft.amount());
        LocalDate date = requireDate(draft.date());
        return new ExpenseDraft(category, amount, date, normalizeDescription(draft.description()));
    }

    private IncomeDraft validate(IncomeDraft draft) {
        Objects.requireNonNull(draft, "draft");
        BigDecimal amount = LedgerAmounts.require(draft.amount());
        LocalDate date = requireDate(draft.date());
        return new IncomeDraft(amount, date, normalizeDescription(draft.description()));
    }

    private static LocalDate requireDate(LocalDate date) {
        if (date == null) {
            throw new ValidationException(ErrorCode.INVALID_DATE, "date is required");
        }
        return date;
    }

    private static String normalizeDescription(String description) {
        if (description == null || description.isBlank()) {
            return null;
        }
        if (description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new ValidationException(ErrorCode.INVALID_DESCRIPTION,
                    "description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        return description;
    }

    private Optional<Expense> toExpense(ExpenseEntity entity) {
        Optional<LocalDate> date = LedgerDates.parse(entity.getSpentOn());
        if (date.isEmpty()) {
            logSkipped("expense", entity.getId(), entity.getSpentOn());
            return Optional.empty();
        }
        return Optional.of(new Expense(
                entity.getId(),
                entity.getUsername(),
                entity.getCategory(),
                entity.getAmount(),
                date.get(),
                entity.getDescription()
        ));
    }

    private Optional<Income> toIncome(IncomeEntity entity) {
        Optional<LocalDate> date = LedgerDates.parse(entity.getReceivedOn());
        if (date.isEmpty()) {
            logSkipped("income", entity.getId(), entity.getReceivedOn());
            return Optional.empty();
        }
        return Optional.of(new Income(
                entity.getId(),
                entity.getUsername(),
                entity.getAmount(),
                date.get(),
                entity.getDescription()
        ));
    }

    private static void logSkipped(String kind, Long id, String storedDate) {
        log.warn("Skipping {} {}: stored date '{}' is not an ISO date", kind, id, storedDate);
    }
}
