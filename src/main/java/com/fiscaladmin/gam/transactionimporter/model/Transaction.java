package com.fiscaladmin.gam.transactionimporter.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A persisted transaction. Amount is signed: negative for debits.
 */
public class Transaction {

    private final String id;
    private final String accountId;
    private final LocalDate postedDate;
    private final BigDecimal amount;
    private final String description;
    private final String category;
    private final String fingerprint;
    private final String importRunId;

    public Transaction(String id, String accountId, LocalDate postedDate, BigDecimal amount,
                       String description, String category, String fingerprint, String importRunId) {
        this.id = id;
        this.accountId = accountId;
        this.postedDate = postedDate;
        this.amount = amount;
        this.description = description;
        this.category = category;
        this.fingerprint = fingerprint;
        this.importRunId = importRunId;
    }

    public String getId() {
        return id;
    }

    public String getAccountId() {
        return accountId;
    }

    public LocalDate getPostedDate() {
        return postedDate;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Returns the category label, or {@code null} if none was assigned.
     */
    public String getCategory() {
        return category;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public String getImportRunId() {
        return importRunId;
    }

    public boolean isDebit() {
        return amount.signum() < 0;
    }

    @Override
    public String toString() {
        return "Transaction{" + postedDate + " " + amount + " " + description + "}";
    }
}
