package com.fiscaladmin.gam.transactionimporter.persister;

import com.fiscaladmin.gam.transactionimporter.model.PendingTransaction;
import com.fiscaladmin.gam.transactionimporter.model.Transaction;
import com.fiscaladmin.gam.transactionimporter.model.TransactionFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Append-only storage of imported transactions plus the account balance cache.
 * <p>
 * Key behaviours:
 * <ul>
 *   <li>{@link #commitBatch} inserts a file's surviving rows and moves each affected
 *       account's balance by the sum of its rows, in one JDBC transaction</li>
 *   <li>Commits are serialized per account through {@link AccountLocks}; commits
 *       for disjoint accounts run concurrently</li>
 *   <li>Under the lock, fingerprints are re-checked so that a row committed by a
 *       parallel import since the duplicate check is skipped, not inserted twice</li>
 *   <li>Only the category of a stored transaction can change</li>
 * </ul>
 */
public class TransactionRepository {

    private static final Logger LOG = LoggerFactory.getLogger(TransactionRepository.class);

    private static final String INSERT_SQL = "INSERT INTO transactions "
            + "(id, account_id, posted_date, amount, description, category, fingerprint, import_run_id) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String UPDATE_BALANCE_SQL =
            "UPDATE accounts SET balance = balance + ? WHERE id = ?";

    private final DataSource dataSource;
    private final AccountLocks locks;

    public TransactionRepository(DataSource dataSource, AccountLocks locks) {
        this.dataSource = dataSource;
        this.locks = locks;
    }

    /**
     * Loads the stored fingerprints of the given accounts.
     *
     * @return account id to fingerprints; every requested id has an entry
     */
    public Map<String, Set<String>> loadFingerprints(Collection<String> accountIds) {
        try (Connection con = dataSource.getConnection()) {
            return loadFingerprints(con, accountIds);
        } catch (SQLException e) {
            throw new StorageException("Cannot load fingerprints: " + e.getMessage(), e);
        }
    }

    private static Map<String, Set<String>> loadFingerprints(Connection con, Collection<String> accountIds)
            throws SQLException {
        Map<String, Set<String>> result = new HashMap<>();
        try (PreparedStatement ps = con.prepareStatement(
                "SELECT fingerprint FROM transactions WHERE account_id = ?")) {
            for (String accountId : new LinkedHashSet<>(accountIds)) {
                Set<String> fingerprints = new HashSet<>();
                ps.setString(1, accountId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        fingerprints.add(rs.getString(1).trim());
                    }
                }
                result.put(accountId, fingerprints);
            }
        }
        return result;
    }

    /**
     * Atomically inserts the pending rows and updates the affected balances.
     * Either everything is committed or nothing is.
     *
     * @param importRunId the run the rows belong to
     * @param pending     rows that survived validation and duplicate detection
     * @return inserted count and the rows skipped as late duplicates
     * @throws StorageException if the batch fails; the transaction has been rolled back
     */
    public CommitResult commitBatch(String importRunId, List<PendingTransaction> pending) {
        if (pending.isEmpty()) {
            return new CommitResult(0, new ArrayList<>());
        }

        Set<String> accountIds = new LinkedHashSet<>();
        for (PendingTransaction p : pending) {
            accountIds.add(p.getAccountId());
        }

        try (AccountLocks.Held held = locks.lockAccounts(accountIds);
             Connection con = dataSource.getConnection()) {
            con.setAutoCommit(false);
            try {
                CommitResult result = commitLocked(con, importRunId, pending, accountIds);
                con.commit();
                LOG.info("Batch insert completed: {} rows committed for run {} ({} late duplicates)",
                        result.getInsertedCount(), importRunId, result.getLateDuplicates().size());
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(con, importRunId);
                throw e;
            } finally {
                con.setAutoCommit(true);
            }
        } catch (SQLException e) {
            LOG.error("Batch insert failed for run {}", importRunId, e);
            throw new StorageException("Batch insert failed: " + e.getMessage(), e);
        }
    }

    private CommitResult commitLocked(Connection con, String importRunId, List<PendingTransaction> pending,
                                      Set<String> accountIds) throws SQLException {
        Map<String, Set<String>> stored = loadFingerprints(con, accountIds);
        List<Integer> lateDuplicates = new ArrayList<>();
        Map<String, BigDecimal> balanceDeltas = new TreeMap<>();
        int inserted = 0;

        try (PreparedStatement ps = con.prepareStatement(INSERT_SQL)) {
            for (PendingTransaction p : pending) {
                if (!stored.get(p.getAccountId()).add(p.getFingerprint())) {
                    lateDuplicates.add(p.getRowNumber());
                    continue;
                }
                ps.setString(1, UUID.randomUUID().toString());
                ps.setString(2, p.getAccountId());
                ps.setDate(3, Date.valueOf(p.getPostedDate()));
                ps.setBigDecimal(4, p.getAmount());
                ps.setString(5, p.getDescription());
                ps.setString(6, p.getCategory());
                ps.setString(7, p.getFingerprint());
                ps.setString(8, importRunId);
                ps.addBatch();
                balanceDeltas.merge(p.getAccountId(), p.getAmount(), BigDecimal::add);
                inserted++;
            }
            if (inserted > 0) {
                int[] results = ps.executeBatch();
                int counted = 0;
                for (int r : results) {
                    if (r >= 0) {
                        counted += r;
                    } else if (r == Statement.SUCCESS_NO_INFO) {
                        counted++;
                    }
                }
                if (counted != inserted) {
                    throw new StorageException("Expected " + inserted + " inserted rows, store reported " + counted);
                }
            }
        }

        try (PreparedStatement ps = con.prepareStatement(UPDATE_BALANCE_SQL)) {
            for (Map.Entry<String, BigDecimal> delta : balanceDeltas.entrySet()) {
                ps.setBigDecimal(1, delta.getValue());
                ps.setString(2, delta.getKey());
                if (ps.executeUpdate() != 1) {
                    throw new StorageException("No account with id " + delta.getKey());
                }
            }
        }
        return new CommitResult(inserted, lateDuplicates);
    }

    private static void rollback(Connection con, String importRunId) {
        try {
            con.rollback();
            LOG.warn("Rolled back batch for run {}", importRunId);
        } catch (SQLException e) {
            LOG.error("Rollback failed for run {}", importRunId, e);
        }
    }

    /**
     * Lists transactions matching the filter, newest posted date first.
     */
    public List<Transaction> list(TransactionFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT id, account_id, posted_date, amount, description, "
                + "category, fingerprint, import_run_id FROM transactions WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        if (filter.getAccountId() != null) {
            sql.append(" AND account_id = ?");
            params.add(filter.getAccountId());
        }
        if (filter.getFromDate() != null) {
            sql.append(" AND posted_date >= ?");
            params.add(Date.valueOf(filter.getFromDate()));
        }
        if (filter.getToDate() != null) {
            sql.append(" AND posted_date <= ?");
            params.add(Date.valueOf(filter.getToDate()));
        }
        if (filter.getCategory() != null) {
            sql.append(" AND category = ?");
            params.add(filter.getCategory());
        }
        sql.append(" ORDER BY posted_date DESC, id DESC");

        List<Transaction> transactions = new ArrayList<>();
        try (Connection con = dataSource.getConnection();
             PreparedStatement ps = con.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    transactions.add(new Transaction(
                            rs.getString("id"),
                            rs.getString("account_id"),
                            rs.getDate("posted_date").toLocalDate(),
                            rs.getBigDecimal("amount"),
                            rs.getString("description"),
                            rs.getString("category"),
                            rs.getString("fingerprint").trim(),
                            rs.getString("import_run_id")));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Cannot list transactions: " + e.getMessage(), e);
        }
        return transactions;
    }

    /**
     * Sets or clears the category of a stored transaction.
     *
     * @param category the new category, or {@code null}/blank to clear it
     * @throws IllegalArgumentException if no transaction has the given id
     */
    public void updateCategory(String transactionId, String category) {
        String value = category == null || category.trim().isEmpty() ? null : category.trim();
        try (Connection con = dataSource.getConnection();
             PreparedStatement ps = con.prepareStatement("UPDATE transactions SET category = ? WHERE id = ?")) {
            ps.setString(1, value);
            ps.setString(2, transactionId);
            if (ps.executeUpdate() == 0) {
                throw new IllegalArgumentException("No transaction with id " + transactionId);
            }
        } catch (SQLException e) {
            throw new StorageException("Cannot update category of " + transactionId + ": " + e.getMessage(), e);
        }
    }

    /**
     * Deletes every transaction and resets every balance to zero. Accounts and
     * import history are kept. Waits for in-flight commits to finish.
     *
     * @return the number of transactions deleted
     */
    public int deleteAll() {
        try (AccountLocks.Held held = locks.lockStore();
             Connection con = dataSource.getConnection()) {
            con.setAutoCommit(false);
            try (Statement stmt = con.createStatement()) {
                int deleted = stmt.executeUpdate("DELETE FROM transactions");
                stmt.executeUpdate("UPDATE accounts SET balance = 0");
                con.commit();
                LOG.info("Deleted all {} transactions and reset balances", deleted);
                return deleted;
            } catch (SQLException e) {
                con.rollback();
                throw e;
            } finally {
                con.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Cannot delete transactions: " + e.getMessage(), e);
        }
    }

    /**
     * Sums stored amounts per account. Used to verify the balance cache.
     */
    public Map<String, BigDecimal> sumByAccount() {
        Map<String, BigDecimal> sums = new LinkedHashMap<>();
        try (Connection con = dataSource.getConnection();
             PreparedStatement ps = con.prepareStatement(
                     "SELECT account_id, SUM(amount) FROM transactions GROUP BY account_id ORDER BY account_id");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                sums.put(rs.getString(1), rs.getBigDecimal(2));
            }
        } catch (SQLException e) {
            throw new StorageException("Cannot sum transactions: " + e.getMessage(), e);
        }
        return sums;
    }
}
