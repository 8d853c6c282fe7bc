package com.fiscaladmin.gam.transactionimporter.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An account as stored in the {@code accounts} table.
 * <p>
 * {@code balance} is a cached value: it always equals the sum of the account's
 * transaction amounts and is only changed by the commit that inserts them.
 */
public class Account {

    private final String id;
    private final String displayName;
    private final String institutionId;
    private final BigDecimal balance;
    private final Instant createdAt;

    public Account(String id, String displayName, String institutionId,
                   BigDecimal balance, Instant createdAt) {
        this.id = id;
        this.displayName = displayName;
        this.institutionId = institutionId;
        this.balance = balance;
        this.createdAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getInstitutionId() {
        return institutionId;
    }

    public BigDecimal getBalance() {
        return balance;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "Account{" + displayName + " [" + institutionId + "], balance=" + balance + "}";
    }
}
