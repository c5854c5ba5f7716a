package com.myfinancehub.ledger.ledger;

import com.myfinancehub.ledger.error.ErrorCode;
import com.myfinancehub.ledger.error.ValidationException;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Money columns are NUMERIC(12, 2): non-negative, two fraction digits, ten integer digits.
 */
final class LedgerAmounts {

    static final int SCALE = 2;
    static final int MAX_INTEGER_DIGITS = 10;

    private LedgerAmounts() {
    }

    static BigDecimal require(BigDecimal amount) {
        if (amount == null) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "amount is required");
        }
        if (amount.signum() < 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "amount must not be negative");
        }
        // integer digits from precision and scale alone, so huge exponents are never expanded
        if (amount.signum() != 0 && (long) amount.precision() - amount.scale() > MAX_INTEGER_DIGITS) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "amount is too large");
        }
        BigDecimal stripped = amount.stripTrailingZeros();
        if (stripped.scale() > SCALE) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "amount must have at most " + SCALE + " decimal places");
        }
        return stripped.setScale(SCALE, RoundingMode.UNNECESSARY);
    }
}
