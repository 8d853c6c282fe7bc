package com.fiscaladmin.gam.transactionimporter.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A validated, fingerprinted row waiting to be committed. Carries its source
 * row number so late rejections can still be reported against the file.
 */
public class PendingTransaction {

    private final int rowNumber;
    private final String accountId;
    private final LocalDate postedDate;
    private final BigDecimal amount;
    private final String description;
    private final String category;
    private final String fingerprint;

    public PendingTransaction(int rowNumber, String accountId, LocalDate postedDate, BigDecimal amount,
                              String description, String category, String fingerprint) {
        this.rowNumber = rowNumber;
        this.accountId = accountId;
        this.postedDate = postedDate;
        this.amount = amount;
        this.description = description;
        this.category = category;
        this.fingerprint = fingerprint;
    }

    public int getRowNumber() {
        return rowNumber;
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

    public String getCategory() {
        return category;
    }

    public String getFingerprint() {
        return fingerprint;
    }
}
