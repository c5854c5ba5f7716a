package com.myfinancehub.ledger.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "incomes")
public class IncomeEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "username", nullable = false, updatable = false, length = 100)
    private String username;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "received_on", nullable = false, length = 32)
    private String receivedOn;

    @Column(name = "description")
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected IncomeEntity() {}

    public IncomeEntity(String username, BigDecimal amount, String receivedOn, String description, Instant createdAt) {
        this.username = username;
        this.amount = amount;
        this.receivedOn = receivedOn;
        this.description = description;
        this.createdAt = createdAt;
    }

    public void rewrite(BigDecimal amount, String receivedOn, String description) {
        this.amount = amount;
        this.receivedOn = receivedOn;
        this.description = description;
    }

    public Long getId() { return id; }
    public String getUsername() { return username; }
    public BigDecimal getAmount() { return amount; }
    public String getReceivedOn() { return receivedOn; }
    public String getDescription() { return description; }
    public Instant getCreatedAt() { return createdAt; }
}
