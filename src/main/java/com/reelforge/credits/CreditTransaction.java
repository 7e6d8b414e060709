package com.reelforge.credits;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Append-only ledger entry. Debits carry a negative amount, credits a
 * positive one; {@code balanceAfter} snapshots the account balance once the
 * entry was applied.
 */
@Entity
@Immutable
@Table(name = "credit_transactions")
public class CreditTransaction {

    @Id
    private UUID id;

    @Column(name = "account_id", nullable = false)
    private UUID accountId;

    @Column(nullable = false)
    private int amount;

    @Convert(converter = CreditColumnConverters.TransactionTypeConverter.class)
    @Column(name = "transaction_type", nullable = false, length = 50)
    private TransactionType transactionType;

    @Column(columnDefinition = "text")
    private String description;

    @Column(name = "reference_id")
    private String referenceId;

    @Column(name = "balance_after", nullable = false)
    private int balanceAfter;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "seq", insertable = false, updatable = false)
    private Long sequence;

    protected CreditTransaction() {
    }

    CreditTransaction(UUID id, UUID accountId, int amount, TransactionType transactionType, String description,
            String referenceId, int balanceAfter, OffsetDateTime createdAt) {
        this.id = id;
        this.accountId = accountId;
        this.amount = amount;
        this.transactionType = transactionType;
        this.description = description;
        this.referenceId = referenceId;
        this.balanceAfter = balanceAfter;
        this.createdAt = createdAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public int getAmount() {
        return amount;
    }

    public TransactionType getTransactionType() {
        return transactionType;
    }

    public String getDescription() {
        return description;
    }

    public String getReferenceId() {
        return referenceId;
    }

    public int getBalanceAfter() {
        return balanceAfter;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public Long getSequence() {
        return sequence;
    }
}
