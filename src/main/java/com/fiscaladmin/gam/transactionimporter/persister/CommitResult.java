package com.fiscaladmin.gam.transactionimporter.persister;

import java.util.Collections;
import java.util.List;

/**
 * Result of one committed batch.
 * <p>
 * {@code lateDuplicates} holds the row numbers of pending rows that another import
 * committed between the duplicate check and this commit. They were skipped, not inserted.
 */
public class CommitResult {

    private final int insertedCount;
    private final List<Integer> lateDuplicates;

    public CommitResult(int insertedCount, List<Integer> lateDuplicates) {
        this.insertedCount = insertedCount;
        this.lateDuplicates = Collections.unmodifiableList(lateDuplicates);
    }

    public int getInsertedCount() {
        return insertedCount;
    }

    public List<Integer> getLateDuplicates() {
        return lateDuplicates;
    }
}
