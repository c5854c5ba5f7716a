package com.myfinancehub.ledger.auth;

import com.myfinancehub.ledger.entity.UserEntity;
import com.myfinancehub.ledger.error.ConflictException;
import com.myfinancehub.ledger.error.ErrorCode;
import com.myfinancehub.ledger.error.NotFoundException;
import com.myfinancehub.ledger.error.ValidationException;
import com.myfinancehub.ledger.model.UserProfile;
import com.myfinancehub.ledger.repository.JpaUserRepository;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * Owns user accounts and their password hashes. Hashes never leave this class; callers see
 * {@link UserProfile} only.
 *
 * <p>None of the methods run inside a transaction. BCrypt hashing and verification happen without
 * a held connection or row lock, and each write is a single statement.
 */
@Service
public class CredentialService {

    private static final Logger log = LoggerFactory.getLogger(CredentialService.class);

    public static final int MAX_USERNAME_LENGTH = 100;
    public static final int MAX_EMAIL_LENGTH = 255;

    private final JpaUserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;
    // compared against when the username is unknown so both failures cost one hash check
    private final String dummyHash;

    @Autowired
    public CredentialService(JpaUserRepository userRepository, PasswordEncoder passwordEncoder) {
        this(userRepository, passwordEncoder, Clock.systemUTC());
    }

    CredentialService(JpaUserRepository userRepository, PasswordEncoder passwordEncoder, Clock clock) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
        this.dummyHash = passwordEncoder.encode("unknown-user-placeholder");
    }

    public UserProfile register(String username, String password, String email) {
        requireValidUsername(username);
        if (userRepository.existsById(username)) {
            throw duplicate(username);
        }
        PasswordPolicy.require(password);
        String normalizedEmail = normalizeEmail(email);

        String hash = passwordEncoder.encode(password);
        UserEntity saved;
        try {
            saved = userRepository.saveAndFlush(new UserEntity(username, hash, normalizedEmail, clock.instant()));
        } catch (DataIntegrityViolationException ex) {
            // lost a race with a concurrent registration of the same name
            throw duplicate(username);
        }
        log.info("Registered user {}", username);
        return toProfile(saved);
    }

    public boolean authenticate(String username, String password) {
        if (username == null || password == null) {
            return false;
        }
        Optional<UserEntity> user = userRepository.findById(username);
        if (user.isEmpty()) {
            passwordEncoder.matches(password, dummyHash);
            log.debug("Authentication failed: unknown user");
            return false;
        }
        boolean matches = passwordEncoder.matches(password, user.get().getPasswordHash());
        if (!matches) {
            log.debug("Authentication failed for {}", username);
        }
        return matches;
    }

    public void changePassword(String username, String currentPassword, String newPassword) {
        UserEntity user = userRepository.findById(username)
                .orElseThrow(() -> new NotFoundException("user " + username + " not found"));
        if (currentPassword == null || !passwordEncoder.matches(currentPassword, user.getPasswordHash())) {
            throw new ValidationException(ErrorCode.INCORRECT_CURRENT_PASSWORD, "current password is incorrect");
        }
        PasswordPolicy.require(newPassword);
        String hash = passwordEncoder.encode(newPassword);
        if (userRepository.updatePasswordHash(username, hash) == 0) {
            throw new NotFoundException("user " + username + " not found");
        }
        log.info("Password changed for {}", username);
    }

    public Optional<UserProfile> findProfile(String username) {
        if (username == null) {
            return Optional.empty();
        }
        return userRepository.findById(username).map(CredentialService::toProfile);
    }

    public UserProfile updateEmail(String username, String email) {
        String normalizedEmail = normalizeEmail(email);
        if (userRepository.updateEmail(username, normalizedEmail) == 0) {
            throw new NotFoundException("user " + username + " not found");
        }
        return findProfile(username)
                .orElseThrow(() -> new NotFoundException("user " + username + " not found"));
    }

    static void requireValidUsername(String username) {
        if (username == null || username.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_USERNAME, "username must not be blank");
        }
        if (!username.equals(username.strip())) {
            throw new ValidationException(ErrorCode.INVALID_USERNAME, "username must not start or end with whitespace");
        }
        if (username.length() > MAX_USERNAME_LENGTH) {
            throw new ValidationException(ErrorCode.INVALID_USERNAME,
                    "username must be at most " + MAX_USERNAME_LENGTH + " characters");
        }
    }

    static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            return null;
        }
        String trimmed = email.trim();
        int at = trimmed.indexOf('@');
        if (trimmed.length() > MAX_EMAIL_LENGTH || at <= 0 || at != trimmed.lastIndexOf('@') || at == trimmed.length() - 1) {
            throw new ValidationException(ErrorCode.INVALID_EMAIL, "email address is not valid");
        }
        return trimmed;
    }

    private static ConflictException duplicate(String username) {
        return new ConflictException(ErrorCode.DUPLICATE_USERNAME, "username " + username + " is already taken");
    }

    private static UserProfile toProfile(UserEntity entity) {
        return new UserProfile(entity.getUsername(), entity.getEmail(), entity.getCreatedAt());
    }
}
