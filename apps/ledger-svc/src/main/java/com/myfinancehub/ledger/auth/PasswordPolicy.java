package com.myfinancehub.ledger.auth;

import com.myfinancehub.ledger.error.ErrorCode;
import com.myfinancehub.ledger.error.ValidationException;
import java.nio.charset.StandardCharsets;

/**
 * Password rule shared by registration and password change: at least 8 characters with an ASCII
 * uppercase letter, an ASCII lowercase letter, a digit and one of {@link #SYMBOLS}. The UTF-8 form
 * may not exceed {@link #MAX_BYTES}, the most bcrypt reads.
 */
public final class PasswordPolicy {

    public static final int MIN_LENGTH = 8;
    public static final int MAX_BYTES = 72;
    public static final String SYMBOLS = "@#$%&*!^()_-+={}[]:;\"'<>,.?/\\|";

    private PasswordPolicy() {
    }

    public static boolean isSatisfiedBy(String password) {
        if (password == null || password.length() < MIN_LENGTH) {
            return false;
        }
        if (password.getBytes(StandardCharsets.UTF_8).length > MAX_BYTES) {
            return false;
        }
        boolean upper = false;
        boolean lower = false;
        boolean digit = false;
        boolean symbol = false;
        for (int i = 0; i < password.length(); i++) {
            char c = password.charAt(i);
            if (c >= 'A' && c <= 'Z') {
                upper = true;
            } else if (c >= 'a' && c <= 'z') {
                lower = true;
            } else if (c >= '0' && c <= '9') {
                digit = true;
            } else if (SYMBOLS.indexOf(c) >= 0) {
                symbol = true;
            }
        }
        return upper && lower && digit && symbol;
    }

    public static void require(String password) {
        if (!isSatisfiedBy(password)) {
            throw new ValidationException(ErrorCode.WEAK_PASSWORD,
                    "password must be " + MIN_LENGTH + " characters to " + MAX_BYTES
                            + " bytes and contain upper and lower case letters, a digit and a symbol");
        }
    }
}
