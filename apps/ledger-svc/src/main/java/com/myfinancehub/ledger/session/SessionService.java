package com.myfinancehub.ledger.session;

import com.myfinancehub.ledger.auth.CredentialService;
import com.myfinancehub.ledger.error.ErrorCode;
import com.myfinancehub.ledger.error.ValidationException;
import com.myfinancehub.ledger.journal.LoginJournal;
import java.time.Clock;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Opens and rebuilds {@link LedgerSession}s. Login checks the credentials, journals the login and
 * starts on the current month; every later request resumes from the token subject.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final CredentialService credentialService;
    private final LoginJournal loginJournal;
    private final Clock clock;

    @Autowired
    public SessionService(CredentialService credentialService, LoginJournal loginJournal) {
        this(credentialService, loginJournal, Clock.systemUTC());
    }

    SessionService(CredentialService credentialService, LoginJournal loginJournal, Clock clock) {
        this.credentialService = credentialService;
        this.loginJournal = loginJournal;
        this.clock = clock;
    }

    public Optional<LedgerSession> login(String username, String password) {
        if (!credentialService.authenticate(username, password)) {
            log.warn("Login rejected for {}", username);
            return Optional.empty();
        }
        loginJournal.recordLogin(username);
        return Optional.of(new LedgerSession(username, currentPeriod()));
    }

    public LedgerSession resume(String username, Optional<YearMonth> period) {
        return new LedgerSession(username, period.orElseGet(this::currentPeriod));
    }

    public YearMonth currentPeriod() {
        return YearMonth.now(clock);
    }

    /**
     * Parses a {@code yyyy-MM} request parameter. Blank means "not given".
     */
    public static Optional<YearMonth> parsePeriod(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        YearMonth period;
        try {
            period = YearMonth.parse(text.trim());
        } catch (DateTimeParseException ex) {
            throw new ValidationException(ErrorCode.INVALID_PERIOD, "month must be formatted as yyyy-MM: " + text);
        }
        if (period.getYear() < 1900 || period.getYear() > 9999) {
            throw new ValidationException(ErrorCode.INVALID_PERIOD, "year must be between 1900 and 9999");
        }
        return Optional.of(period);
    }
}
