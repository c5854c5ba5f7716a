package com.myfinancehub.ledger.ledger;

import com.myfinancehub.ledger.config.LedgerProperties;
import com.myfinancehub.ledger.error.ErrorCode;
import com.myfinancehub.ledger.error.ValidationException;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Decides which category labels expenses and budgets may carry. Restricted mode (the default)
 * accepts only the configured list, matched exactly; open mode accepts any non-blank label.
 */
@Component
public class CategoryPolicy {

    public static final int MAX_CATEGORY_LENGTH = 100;

    private final List<String> categories;
    private final boolean restricted;

    public CategoryPolicy(LedgerProperties properties) {
        this.categories = properties.ledger().categories();
        this.restricted = properties.ledger().restrictCategoriesFlag();
    }

    public List<String> categories() {
        return categories;
    }

    public boolean restricted() {
        return restricted;
    }

    /**
     * @return the category with surrounding whitespace removed
     */
    public String requireAllowed(String category) {
        if (category == null || category.isBlank()) {
            throw new ValidationException(ErrorCode.UNKNOWN_CATEGORY, "category must not be blank");
        }
        String trimmed = category.trim();
        if (trimmed.length() > MAX_CATEGORY_LENGTH) {
            throw new ValidationException(ErrorCode.UNKNOWN_CATEGORY,
                    "category must be at most " + MAX_CATEGORY_LENGTH + " characters");
        }
        if (restricted && !categories.contains(trimmed)) {
            throw new ValidationException(ErrorCode.UNKNOWN_CATEGORY,
                    "unknown category '" + trimmed + "', expected one of " + categories);
        }
        return trimmed;
    }
}
