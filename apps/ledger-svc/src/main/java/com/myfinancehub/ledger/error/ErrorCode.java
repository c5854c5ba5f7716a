package com.myfinancehub.ledger.error;

public enum ErrorCode {
    INVALID_USERNAME,
    WEAK_PASSWORD,
    INCORRECT_CURRENT_PASSWORD,
    INVALID_AMOUNT,
    INVALID_DATE,
    INVALID_DESCRIPTION,
    UNKNOWN_CATEGORY,
    INVALID_PERIOD,
    INVALID_RANGE,
    INVALID_EMAIL,
    NOT_FOUND,
    DUPLICATE_USERNAME,
    STORAGE_UNAVAILABLE
}
