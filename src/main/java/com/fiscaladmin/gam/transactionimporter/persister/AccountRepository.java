package com.fiscaladmin.gam.transactionimporter.persister;

import com.fiscaladmin.gam.transactionimporter.model.Account;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD over the {@code accounts} table.
 * <p>
 * The balance column is never written here except by the cascade in {@link #delete(String)};
 * it is maintained by {@link TransactionRepository#commitBatch} alone.
 * Display names are unique.
 */
public class AccountRepository {

    private static final Logger LOG = LoggerFactory.getLogger(AccountRepository.class);

    static final String UNIQUE_VIOLATION = "23505";

    private static final String SELECT_COLUMNS =
            "SELECT id, display_name, institution_id, balance, created_at FROM accounts";

    private final DataSource dataSource;
    private final AccountLocks locks;
    private final Clock clock;

    /**
     * @param clock source of {@code created_at}
     */
    public AccountRepository(DataSource dataSource, AccountLocks locks, Clock clock) {
        this.dataSource = dataSource;
        this.locks = locks;
        this.clock = clock;
    }

    /**
     * Creates an account with a zero balance.
     *
     * @throws IllegalArgumentException if the name is blank or already taken
     */
    public Account create(String displayName, String institutionId) {
        String name = requireName(displayName);
        Account account = new Account(UUID.randomUUID().toString(), name,
                institutionId != null ? institutionId : "manual", BigDecimal.ZERO.setScale(2), Instant.now(clock));
        try (Connection con = dataSource.getConnection()) {
            insert(con, account);
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                throw new IllegalArgumentException("Account name already exists: " + name, e);
            }
            throw new StorageException("Cannot create account " + name + ": " + e.getMessage(), e);
        }
        LOG.info("Created account {} ({})", account.getDisplayName(), account.getId());
        return account;
    }

    /**
     * Returns the account with the given name, creating it when absent.
     * Safe to call concurrently: a creation race is resolved by re-reading the winner.
     */
    public Account findOrCreate(String displayName, String institutionId) {
        Optional<Account> existing = findByName(displayName);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            return create(displayName, institutionId);
        } catch (IllegalArgumentException e) {
            // created by a concurrent import between the lookup and the insert
            return findByName(displayName).orElseThrow(() ->
                    new StorageException("Account " + displayName + " vanished after a name conflict", e));
        }
    }

    public Optional<Account> findById(String id) {
        return querySingle(SELECT_COLUMNS + " WHERE id = ?", id);
    }

    public Optional<Account> findByName(String displayName) {
        if (displayName == null) {
            return Optional.empty();
        }
        return querySingle(SELECT_COLUMNS + " WHERE display_name = ?", displayName.trim());
    }

    public List<Account> listAll() {
        List<Account> accounts = new ArrayList<>();
        try (Connection con = dataSource.getConnection();
             PreparedStatement ps = con.prepareStatement(SELECT_COLUMNS + " ORDER BY display_name");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                accounts.add(read(rs));
            }
        } catch (SQLException e) {
            throw new StorageException("Cannot list accounts: " + e.getMessage(), e);
        }
        return accounts;
    }

    /**
     * Renames an account or changes its institution. The balance is not editable.
     *
     * @throws IllegalArgumentException if the account does not exist or the new name is taken
     */
    public Account update(String id, String displayName, String institutionId) {
        String name = requireName(displayName);
        try (Connection con = dataSource.getConnection();
             PreparedStatement ps = con.prepareStatement(
                     "UPDATE accounts SET display_name = ?, institution_id = COALESCE(?, institution_id) WHERE id = ?")) {
            ps.setString(1, name);
            ps.setString(2, institutionId);
            ps.setString(3, id);
            if (ps.executeUpdate() == 0) {
                throw new IllegalArgumentException("No account with id " + id);
            }
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                throw new IllegalArgumentException("Account name already exists: " + name, e);
            }
            throw new StorageException("Cannot update account " + id + ": " + e.getMessage(), e);
        }
        return findById(id).orElseThrow(() -> new IllegalArgumentException("No account with id " + id));
    }

    /**
     * Deletes an account and, by cascade, all of its transactions. Waits for any
     * in-flight commit on the account.
     *
     * @throws IllegalArgumentException if the account does not exist
     */
    public void delete(String id) {
        try (AccountLocks.Held held = locks.lockAccounts(Collections.singleton(id));
             Connection con = dataSource.getConnection();
             PreparedStatement ps = con.prepareStatement("DELETE FROM accounts WHERE id = ?")) {
            ps.setString(1, id);
            int deleted = ps.executeUpdate();
            // the id is gone for good either way
            locks.forget(id);
            if (deleted == 0) {
                throw new IllegalArgumentException("No account with id " + id);
            }
        } catch (SQLException e) {
            throw new StorageException("Cannot delete account " + id + ": " + e.getMessage(), e);
        }
        LOG.info("Deleted account {} and its transactions", id);
    }

    private void insert(Connection con, Account account) throws SQLException {
        try (PreparedStatement ps = con.prepareStatement(
                "INSERT INTO accounts (id, display_name, institution_id, balance, created_at) VALUES (?, ?, ?, ?, ?)")) {
            ps.setString(1, account.getId());
            ps.setString(2, account.getDisplayName());
            ps.setString(3, account.getInstitutionId());
            ps.setBigDecimal(4, account.getBalance());
            ps.setTimestamp(5, Timestamp.from(account.getCreatedAt()));
            ps.executeUpdate();
        }
    }

    private Optional<Account> querySingle(String sql, String param) {
        try (Connection con = dataSource.getConnection();
             PreparedStatement ps = con.prepareStatement(sql)) {
            ps.setString(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(read(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Account lookup failed: " + e.getMessage(), e);
        }
    }

    private static Account read(ResultSet rs) throws SQLException {
        return new Account(
                rs.getString("id"),
                rs.getString("display_name"),
                rs.getString("institution_id"),
                rs.getBigDecimal("balance"),
                rs.getTimestamp("created_at").toInstant());
    }

    private static String requireName(String displayName) {
        if (displayName == null || displayName.trim().isEmpty()) {
            throw new IllegalArgumentException("Account name must not be blank");
        }
        return displayName.trim();
    }
}
