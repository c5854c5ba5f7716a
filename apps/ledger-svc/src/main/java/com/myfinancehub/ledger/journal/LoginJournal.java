package com.myfinancehub.ledger.journal;

import com.myfinancehub.ledger.config.LedgerProperties;
import com.myfinancehub.ledger.entity.LoginEventEntity;
import com.myfinancehub.ledger.repository.JpaLoginEventRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only record of successful logins. Recording is best effort: a storage failure is logged and
 * never fails the login itself.
 */
@Component
public class LoginJournal {

    private static final Logger log = LoggerFactory.getLogger(LoginJournal.class);

    private final JpaLoginEventRepository repository;
    private final int defaultLimit;
    private final Clock clock;

    @Autowired
    public LoginJournal(JpaLoginEventRepository repository, LedgerProperties properties) {
        this(repository, properties.journal().recentLimit(), Clock.systemUTC());
    }

    LoginJournal(JpaLoginEventRepository repository, int defaultLimit, Clock clock) {
        if (defaultLimit <= 0) {
            throw new IllegalArgumentException("defaultLimit must be positive");
        }
        this.repository = repository;
        this.defaultLimit = defaultLimit;
        this.clock = clock;
    }

    // not @Transactional: the save commits on its own so a failure surfaces here, not in the caller
    public void recordLogin(String username) {
        Instant now = clock.instant();
        try {
            repository.save(new LoginEventEntity(username, now));
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Could not record login for {} at {}: {}", username, now, ex.getMessage());
        }
    }

    @Transactional(readOnly = true)
    public List<Instant> recentLogins(String username) {
        return recentLogins(username, defaultLimit);
    }

    @Transactional(readOnly = true)
    public List<Instant> recentLogins(String username, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return repository.findByUsernameOrderByOccurredAtDescIdDesc(username, PageRequest.of(0, limit)).stream()
                .map(LoginEventEntity::getOccurredAt)
                .toList();
    }

    int defaultLimit() {
        return defaultLimit;
    }
}
