package com.fiscaladmin.gam.transactionimporter.model;

import java.time.LocalDate;

/**
 * Optional criteria for listing or exporting transactions. Every criterion left
 * {@code null} matches all rows. The date range is inclusive on both ends.
 */
public class TransactionFilter {

    private static final TransactionFilter ALL = new TransactionFilter(null, null, null, null);

    private final String accountId;
    private final LocalDate fromDate;
    private final LocalDate toDate;
    private final String category;

    private TransactionFilter(String accountId, LocalDate fromDate, LocalDate toDate, String category) {
        if (fromDate != null && toDate != null && fromDate.isAfter(toDate)) {
            throw new IllegalArgumentException("fromDate " + fromDate + " is after toDate " + toDate);
        }
        this.accountId = accountId;
        this.fromDate = fromDate;
        this.toDate = toDate;
        this.category = category;
    }

    public static TransactionFilter all() {
        return ALL;
    }

    public static TransactionFilter forAccount(String accountId) {
        return new TransactionFilter(accountId, null, null, null);
    }

    public TransactionFilter withAccount(String accountId) {
        return new TransactionFilter(accountId, fromDate, toDate, category);
    }

    public TransactionFilter withDateRange(LocalDate from, LocalDate to) {
        return new TransactionFilter(accountId, from, to, category);
    }

    public TransactionFilter withCategory(String category) {
        return new TransactionFilter(accountId, fromDate, toDate, category);
    }

    public String getAccountId() {
        return accountId;
    }

    public LocalDate getFromDate() {
        return fromDate;
    }

    public LocalDate getToDate() {
        return toDate;
    }

    public String getCategory() {
        return category;
    }
}
