package com.myfinancehub.ledger.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;

@Entity
@Table(name = "budgets", uniqueConstraints = @UniqueConstraint(
        name = "uq_budgets_owner_period",
        columnNames = {"username", "category", "budget_month", "budget_year"}))
public class BudgetEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "username", nullable = false, updatable = false, length = 100)
    private String username;

    @Column(name = "category", nullable = false, length = 100)
    private String category;

    @Column(name = "budget_month", nullable = false)
    private int month;

    @Column(name = "budget_year", nullable = false)
    private int year;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    protected BudgetEntity() {}

    public BudgetEntity(String username, String category, int month, int year, BigDecimal amount) {
        this.username = username;
        this.category = category;
        this.month = month;
        this.year = year;
        this.amount = amount;
    }

    public Long getId() { return id; }
    public String getUsername() { return username; }
    public String getCategory() { return category; }
    public int getMonth() { return month; }
    public int getYear() { return year; }
    public BigDecimal getAmount() { return amount; }
}
