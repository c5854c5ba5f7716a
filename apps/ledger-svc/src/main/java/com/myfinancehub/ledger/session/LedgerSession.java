package com.myfinancehub.ledger.session;

import java.time.YearMonth;
import java.util.Objects;

/**
 * The authenticated user together with the reporting month the caller is looking at.
 */
public record LedgerSession(String username, YearMonth period) {

    public LedgerSession {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(period, "period");
    }

    public LedgerSession withPeriod(YearMonth newPeriod) {
        return new LedgerSession(username, newPeriod);
    }
}
