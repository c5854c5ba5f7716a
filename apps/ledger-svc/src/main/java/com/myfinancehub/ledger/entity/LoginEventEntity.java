package com.myfinancehub.ledger.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "login_events")
public class LoginEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "username", nullable = false, updatable = false, length = 100)
    private String username;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    protected LoginEventEntity() {}

    public LoginEventEntity(String username, Instant occurredAt) {
        this.username = username;
        this.occurredAt = occurredAt;
    }

    public Long getId() { return id; }
    public String getUsername() { return username; }
    public Instant getOccurredAt() { return occurredAt; }
}
