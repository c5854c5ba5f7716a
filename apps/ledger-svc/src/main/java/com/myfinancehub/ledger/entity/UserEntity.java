package com.myfinancehub.ledger.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import java.time.Instant;
import org.springframework.data.domain.Persistable;

/**
 * Account row keyed by the username itself. Implements {@link Persistable} so that saving a new user
 * always issues an INSERT: a clash on the key must fail, not merge into the existing account.
 */
@Entity
@Table(name = "users")
public class UserEntity implements Persistable<String> {
    @Id
    @Column(name = "username", nullable = false, updatable = false, length = 100)
    private String username;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Column(name = "email")
    private String email;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Transient
    private boolean fresh = true;

    protected UserEntity() {}

    public UserEntity(String username, String passwordHash, String email, Instant createdAt) {
        this.username = username;
        this.passwordHash = passwordHash;
        this.email = email;
        this.createdAt = createdAt;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.fresh = false;
    }

    @Override
    public String getId() { return username; }

    @Override
    public boolean isNew() { return fresh; }

    public String getUsername() { return username; }
    public String getPasswordHash() { return passwordHash; }
    public String getEmail() { return email; }
    public Instant getCreatedAt() { return createdAt; }
}
