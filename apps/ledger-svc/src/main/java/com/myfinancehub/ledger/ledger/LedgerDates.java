package com.myfinancehub.ledger.ledger;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Stored ledger dates are ISO-8601 text ({@code yyyy-MM-dd}). Range queries compare that text, so
 * parsing is exact: padded or otherwise malformed text is unreadable everywhere, not just in ranges.
 */
final class LedgerDates {

    private LedgerDates() {
    }

    static String format(LocalDate date) {
        return DateTimeFormatter.ISO_LOCAL_DATE.format(date);
    }

    static Optional<LocalDate> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }
}
