package com.myfinancehub.ledger.error;

/**
 * Input rejected before any write took place.
 */
public class ValidationException extends LedgerException {

    public ValidationException(ErrorCode code, String message) {
        super(code, message);
    }
}
