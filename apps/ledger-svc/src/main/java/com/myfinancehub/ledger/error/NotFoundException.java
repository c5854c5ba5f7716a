package com.myfinancehub.ledger.error;

/**
 * The targeted row does not exist or is owned by another user. The two cases are reported alike.
 */
public class NotFoundException extends LedgerException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
