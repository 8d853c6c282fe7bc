package com.fiscaladmin.gam.transactionimporter.dedup;

import com.fiscaladmin.gam.transactionimporter.mapping.TransactionDraft;
import com.fiscaladmin.gam.transactionimporter.model.PendingTransaction;
import com.fiscaladmin.gam.transactionimporter.model.RowError;
import com.fiscaladmin.gam.transactionimporter.model.RowErrorCode;
import com.fiscaladmin.gam.transactionimporter.persister.TransactionRepository;
import com.fiscaladmin.gam.transactionimporter.validation.ValidatedDraft;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drops validated rows whose fingerprint is already stored for their account or
 * already appeared earlier in the same file.
 * <p>
 * The check runs in two levels:
 * <ol>
 *   <li>Load the stored fingerprints of every account the file touches</li>
 *   <li>Walk the rows in file order; the first row with a given fingerprint
 *       survives, later ones are reported as {@code DUPLICATE}</li>
 * </ol>
 * A parallel import of another file may commit the same transaction after this
 * check; {@link TransactionRepository#commitBatch} re-checks under the account lock.
 */
public class DeduplicationChecker {

    private static final Logger LOG = LoggerFactory.getLogger(DeduplicationChecker.class);

    private DeduplicationChecker() {
        // utility class
    }

    /**
     * Checks validated rows against the store.
     *
     * @param rows         rows that passed validation, in file order
     * @param transactions store used to load existing fingerprints
     * @return survivors ready to commit plus the duplicates found
     */
    public static DeduplicationResult check(List<ValidatedDraft> rows, TransactionRepository transactions) {
        LOG.info("De-duplication check: {} rows", rows.size());
        if (rows.isEmpty()) {
            return new DeduplicationResult(Collections.emptyList(), Collections.emptyList(), 0);
        }
        Set<String> accountIds = new LinkedHashSet<>();
        for (ValidatedDraft row : rows) {
            accountIds.add(row.getAccountId());
        }
        return check(rows, transactions.loadFingerprints(accountIds));
    }

    /**
     * Checks rows against pre-loaded fingerprints.
     * <p>
     * Package-private for unit testing without a database.
     *
     * @param stored account id to stored fingerprints; missing accounts count as empty
     */
    static DeduplicationResult check(List<ValidatedDraft> rows, Map<String, Set<String>> stored) {
        Map<String, Set<String>> seen = new HashMap<>();
        List<PendingTransaction> survivors = new ArrayList<>();
        List<RowError> duplicates = new ArrayList<>();

        for (ValidatedDraft row : rows) {
            TransactionDraft d = row.getDraft();
            String fingerprint = Fingerprints.of(row.getAccountId(), d.getPostedDate(), d.getAmount(),
                    d.getDescription());

            Set<String> known = seen.computeIfAbsent(row.getAccountId(),
                    id -> new HashSet<>(stored.getOrDefault(id, Collections.emptySet())));
            if (!known.add(fingerprint)) {
                duplicates.add(new RowError(d.getRowNumber(), RowErrorCode.DUPLICATE,
                        "Duplicate of an existing transaction: " + d.getPostedDate() + " "
                                + d.getAmount().toPlainString() + " " + d.getDescription()));
                continue;
            }
            survivors.add(new PendingTransaction(d.getRowNumber(), row.getAccountId(), d.getPostedDate(),
                    d.getAmount(), d.getDescription().trim(), d.getCategory(), fingerprint));
        }

        LOG.info("De-duplication result: {} duplicates, {} new rows out of {} total",
                duplicates.size(), survivors.size(), rows.size());
        return new DeduplicationResult(survivors, duplicates, rows.size());
    }
}
