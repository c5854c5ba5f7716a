package com.myfinancehub.ledger.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "myfinancehub")
public record LedgerProperties(
        Ledger ledger,
        Analytics analytics,
        Journal journal,
        Security security
) {

    public static final List<String> DEFAULT_CATEGORIES = List.of(
            "Food", "Transport", "Utilities", "Entertainment", "Health", "Education", "Other");

    @ConstructorBinding
    public LedgerProperties {
        if (security == null) {
            throw new IllegalArgumentException("security configuration must be provided");
        }
        // ledger, analytics and journal fall back to defaults via their accessors
    }

    public Ledger ledger() {
        return ledger != null ? ledger : new Ledger(null, null);
    }

    public Analytics analytics() {
        return analytics != null ? analytics : new Analytics(null, null);
    }

    public Journal journal() {
        return journal != null ? journal : new Journal(null);
    }

    /**
     * Category rules. With {@code restrictCategories} on (the default) only the listed categories are
     * accepted; with it off any non-blank label is.
     */
    public record Ledger(List<String> categories, Boolean restrictCategories) {
        public Ledger {
            if (categories == null || categories.isEmpty()) {
                categories = DEFAULT_CATEGORIES;
            } else {
                categories = categories.stream()
                        .map(String::trim)
                        .filter(category -> !category.isEmpty())
                        .distinct()
                        .toList();
                if (categories.isEmpty()) {
                    throw new IllegalArgumentException("categories must contain at least one non-blank entry");
                }
            }
        }

        public boolean restrictCategoriesFlag() {
            return restrictCategories == null || restrictCategories;
        }
    }

    public record Analytics(Integer topCategories, Integer trendWindowMonths) {
        public Analytics {
            if (topCategories == null) {
                topCategories = 3;
            }
            if (trendWindowMonths == null) {
                trendWindowMonths = 6;
            }
            if (topCategories <= 0) {
                throw new IllegalArgumentException("topCategories must be positive");
            }
            if (trendWindowMonths <= 0) {
                throw new IllegalArgumentException("trendWindowMonths must be positive");
            }
        }
    }

    public record Journal(Integer recentLimit) {
        public Journal {
            if (recentLimit == null) {
                recentLimit = 5;
            }
            if (recentLimit <= 0) {
                throw new IllegalArgumentException("recentLimit must be positive");
            }
        }
    }

    public record Security(String jwtSecret, Long tokenTtlSeconds) {
        public Security {
            if (tokenTtlSeconds == null) {
                tokenTtlSeconds = 3600L;
            }
            if (tokenTtlSeconds <= 0) {
                throw new IllegalArgumentException("tokenTtlSeconds must be positive");
            }
        }

        public boolean hasJwtSecret() {
            return jwtSecret != null && !jwtSecret.isBlank();
        }
    }
}
