package com.fiscaladmin.gam.transactionimporter.mapping;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A canonical transaction produced by {@link ProfileMapper}, not yet validated.
 * The account is still a name; it is resolved to an id during validation.
 */
public class TransactionDraft {

    private final int rowNumber;
    private final String accountName;
    private final String institutionId;
    private final LocalDate postedDate;
    private final BigDecimal amount;
    private final String description;
    private final String category;

    public TransactionDraft(int rowNumber, String accountName, String institutionId,
                            LocalDate postedDate, BigDecimal amount, String description, String category) {
        this.rowNumber = rowNumber;
        this.accountName = accountName;
        this.institutionId = institutionId;
        this.postedDate = postedDate;
        this.amount = amount;
        this.description = description;
        this.category = category;
    }

    public int getRowNumber() {
        return rowNumber;
    }

    public String getAccountName() {
        return accountName;
    }

    public String getInstitutionId() {
        return institutionId;
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
}
