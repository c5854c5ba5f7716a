package com.myfinancehub.ledger.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.myfinancehub.ledger.config.LedgerProperties;
import com.myfinancehub.ledger.error.ErrorCode;
import com.myfinancehub.ledger.error.ValidationException;
import java.util.List;
import org.junit.jupiter.api.Test;

class CategoryPolicyTest {

    @Test
    void restrictedModeAcceptsOnlyConfiguredCategories() {
        CategoryPolicy policy = policy(null);

        assertThat(policy.restricted()).isTrue();
        assertThat(policy.requireAllowed(" Food ")).isEqualTo("Food");
        assertThatThrownBy(() -> policy.requireAllowed("Groceries"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Groceries")
                .extracting(ex -> ((ValidationException) ex).code())
                .isEqualTo(ErrorCode.UNKNOWN_CATEGORY);
    }

    @Test
    void restrictedModeIsCaseSensitive() {
        assertThatThrownBy(() -> policy(true).requireAllowed("food"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void openModeAcceptsAnyNonBlankLabel() {
        CategoryPolicy policy = policy(false);

        assertThat(policy.restricted()).isFalse();
        assertThat(policy.requireAllowed("Groceries")).isEqualTo("Groceries");
        assertThatThrownBy(() -> policy.requireAllowed("  "))
                .isInstanceOf(ValidationException.class)
                .extracting(ex -> ((ValidationException) ex).code())
                .isEqualTo(ErrorCode.UNKNOWN_CATEGORY);
        assertThatThrownBy(() -> policy.requireAllowed("x".repeat(101)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void nullCategoryIsRejected() {
        assertThatThrownBy(() -> policy(false).requireAllowed(null))
                .isInstanceOf(ValidationException.class);
    }

    private static CategoryPolicy policy(Boolean restrict) {
        return new CategoryPolicy(new LedgerProperties(
                new LedgerProperties.Ledger(List.of(), restrict),
                null,
                null,
                new LedgerProperties.Security("0123456789abcdef0123456789abcdef", null)
        ));
    }
}
