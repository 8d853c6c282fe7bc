package com.fiscaladmin.gam.transactionimporter.validation;

import com.fiscaladmin.gam.transactionimporter.mapping.TransactionDraft;

/**
 * A draft that passed validation, with its account resolved to a stored id.
 */
public class ValidatedDraft {

    private final TransactionDraft draft;
    private final String accountId;

    public ValidatedDraft(TransactionDraft draft, String accountId) {
        this.draft = draft;
        this.accountId = accountId;
    }

    public TransactionDraft getDraft() {
        return draft;
    }

    public String getAccountId() {
        return accountId;
    }
}
