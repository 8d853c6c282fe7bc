package com.fiscaladmin.gam.transactionimporter.dedup;

import com.fiscaladmin.gam.transactionimporter.model.PendingTransaction;
import com.fiscaladmin.gam.transactionimporter.model.RowError;

import java.util.Collections;
import java.util.List;

/**
 * Immutable result of a de-duplication check.
 * <p>
 * Contains the rows that should be committed, plus one {@code DUPLICATE} error
 * per dropped row for reporting.
 */
public class DeduplicationResult {

    private final List<PendingTransaction> survivors;
    private final List<RowError> duplicates;
    private final int totalCount;

    public DeduplicationResult(List<PendingTransaction> survivors, List<RowError> duplicates, int totalCount) {
        this.survivors = Collections.unmodifiableList(survivors);
        this.duplicates = Collections.unmodifiableList(duplicates);
        this.totalCount = totalCount;
    }

    /**
     * Returns the rows that are not duplicates, fingerprinted and ready to commit.
     */
    public List<PendingTransaction> getSurvivors() {
        return survivors;
    }

    public List<RowError> getDuplicates() {
        return duplicates;
    }

    public int getDuplicateCount() {
        return duplicates.size();
    }

    /**
     * Returns the total number of rows checked (duplicates + survivors).
     */
    public int getTotalCount() {
        return totalCount;
    }
}
