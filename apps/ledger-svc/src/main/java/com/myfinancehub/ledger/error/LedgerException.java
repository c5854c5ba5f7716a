package com.myfinancehub.ledger.error;

/**
 * Base type for the expected failures of the ledger core. Callers branch on {@link #code()};
 * the HTTP layer maps each subtype to a status in {@code ApiExceptionHandler}.
 */
public abstract class LedgerException extends RuntimeException {

    private final ErrorCode code;

    protected LedgerException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
