package com.fiscaladmin.gam.transactionimporter.mapping;

import com.fiscaladmin.gam.transactionimporter.model.RowError;

/**
 * Outcome of mapping one raw row: either a draft or a row error, never both.
 */
public class MappingResult {

    private final TransactionDraft draft;
    private final RowError error;

    private MappingResult(TransactionDraft draft, RowError error) {
        this.draft = draft;
        this.error = error;
    }

    public static MappingResult success(TransactionDraft draft) {
        return new MappingResult(draft, null);
    }

    public static MappingResult failure(RowError error) {
        return new MappingResult(null, error);
    }

    public boolean isSuccess() {
        return draft != null;
    }

    public TransactionDraft getDraft() {
        return draft;
    }

    public RowError getError() {
        return error;
    }
}
