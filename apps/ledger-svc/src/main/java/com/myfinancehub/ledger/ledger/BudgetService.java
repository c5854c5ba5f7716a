package com.myfinancehub.ledger.ledger;

import com.myfinancehub.ledger.entity.BudgetEntity;
import com.myfinancehub.ledger.error.ErrorCode;
import com.myfinancehub.ledger.error.NotFoundException;
import com.myfinancehub.ledger.error.ValidationException;
import com.myfinancehub.ledger.model.Budget;
import com.myfinancehub.ledger.repository.JpaBudgetRepository;
import com.myfinancehub.ledger.repository.JpaUserRepository;
import java.math.BigDecimal;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Monthly category budgets. There is at most one budget per (user, category, month, year); setting it
 * again replaces the previous row.
 */
@Service
public class BudgetService {

    private static final Logger log = LoggerFactory.getLogger(BudgetService.class);

    public static final int MIN_YEAR = 1900;
    public static final int MAX_YEAR = 9999;

    private final JpaBudgetRepository budgetRepository;
    private final JpaUserRepository userRepository;
    private final CategoryPolicy categoryPolicy;

    public BudgetService(JpaBudgetRepository budgetRepository,
                         JpaUserRepository userRepository,
                         CategoryPolicy categoryPolicy) {
        this.budgetRepository = budgetRepository;
        this.userRepository = userRepository;
        this.categoryPolicy = categoryPolicy;
    }

    /**
     * Replaces the budget for the tuple. The owner's account row is locked first, so concurrent writes
     * for one user run one after the other and the delete and insert commit together.
     */
    @Transactional
    public Budget setBudget(String username, String category, int month, int year, BigDecimal amount) {
        String validCategory = categoryPolicy.requireAllowed(category);
        BigDecimal validAmount = LedgerAmounts.require(amount);
        requirePeriod(month, year);

        userRepository.lockByUsername(username)
                .orElseThrow(() -> new NotFoundException("user " + username + " not found"));
        int replaced = budgetRepository.deleteByTuple(username, validCategory, month, year);
        BudgetEntity saved = budgetRepository.saveAndFlush(
                new BudgetEntity(username, validCategory, month, year, validAmount));
        log.info("Budget {} {}/{} set to {}{}", validCategory, month, year, validAmount,
                replaced > 0 ? " (replaced previous)" : "");
        return toModel(saved);
    }

    @Transactional(readOnly = true)
    public List<Budget> listBudgets(String username, int month, int year) {
        requirePeriod(month, year);
        return budgetRepository.findByOwnerAndPeriod(username, month, year).stream()
                .map(BudgetService::toModel)
                .toList();
    }

    static void requirePeriod(int month, int year) {
        if (month < 1 || month > 12) {
            throw new ValidationException(ErrorCode.INVALID_PERIOD, "month must be between 1 and 12");
        }
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new ValidationException(ErrorCode.INVALID_PERIOD,
                    "year must be between " + MIN_YEAR + " and " + MAX_YEAR);
        }
    }

    private static Budget toModel(BudgetEntity entity) {
        return new Budget(
                entity.getId(),
                entity.getUsername(),
                entity.getCategory(),
                entity.getMonth(),
                entity.getYear(),
                entity.getAmount()
        );
    }
}
