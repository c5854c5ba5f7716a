package com.myfinancehub.ledger.error;

public class ConflictException extends LedgerException {

    public ConflictException(ErrorCode code, String message) {
        super(code, message);
    }
}
