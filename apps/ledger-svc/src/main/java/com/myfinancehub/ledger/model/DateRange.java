package com.myfinancehub.ledger.model;

import com.myfinancehub.ledger.error.ErrorCode;
import com.myfinancehub.ledger.error.ValidationException;
import java.time.LocalDate;

/**
 * Closed date interval, both ends inclusive.
 */
public record DateRange(LocalDate from, LocalDate to) {

    public DateRange {
        if (from == null || to == null) {
            throw new ValidationException(ErrorCode.INVALID_RANGE, "range requires both from and to");
        }
        if (from.isAfter(to)) {
            throw new ValidationException(ErrorCode.INVALID_RANGE, "range start " + from + " is after end " + to);
        }
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(from) && !date.isAfter(to);
    }
}
