package com.myfinancehub.ledger.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "expenses")
public class ExpenseEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "username", nullable = false, updatable = false, length = 100)
    private String username;

    @Column(name = "category", nullable = false, length = 100)
    private String category;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    // ISO-8601 text, as in the legacy ledger database
    @Column(name = "spent_on", nullable = false, length = 32)
    private String spentOn;

    @Column(name = "description")
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ExpenseEntity() {}

    public ExpenseEntity(String username, String category, BigDecimal amount, String spentOn,
                         String description, Instant createdAt) {
        this.username = username;
        this.category = category;
        this.amount = amount;
        this.spentOn = spentOn;
        this.description = description;
        this.createdAt = createdAt;
    }

    public void rewrite(String category, BigDecimal amount, String spentOn, String description) {
        this.category = category;
        this.amount = amount;
        this.spentOn = spentOn;
        this.description = description;
    }

    public Long getId() { return id; }
    public String getUsername() { return username; }
    public String getCategory() { return category; }
    public BigDecimal getAmount() { return amount; }
    public String getSpentOn() { return spentOn; }
    public String getDescription() { return description; }
    public Instant getCreatedAt() { return createdAt; }
}
