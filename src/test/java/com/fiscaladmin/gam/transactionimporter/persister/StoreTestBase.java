package com.fiscaladmin.gam.transactionimporter.persister;

import com.fiscaladmin.gam.transactionimporter.model.ImportRun;
import com.fiscaladmin.gam.transactionimporter.model.PendingTransaction;
import org.junit.After;
import org.junit.Before;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Base class for tests that need a real store.
 * <p>
 * Each test gets its own in-memory H2 database with the production schema,
 * plus repositories sharing one {@link AccountLocks}.
 */
public abstract class StoreTestBase {

    protected Database database;
    protected AccountLocks locks;
    protected AccountRepository accounts;
    protected TransactionRepository transactions;
    protected ImportRunRepository runs;

    @Before
    public void setUpStore() {
        database = Database.open("jdbc:h2:mem:store-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "", 4);
        locks = new AccountLocks(Duration.ofSeconds(5));
        accounts = new AccountRepository(database.getDataSource(), locks, Clock.systemUTC());
        transactions = new TransactionRepository(database.getDataSource(), locks);
        runs = new ImportRunRepository(database.getDataSource());
    }

    @After
    public void tearDownStore() throws SQLException {
        try (Connection con = database.getConnection(); Statement stmt = con.createStatement()) {
            stmt.execute("DROP ALL OBJECTS");
        }
        database.close();
    }

    // -------------------------------------------------------------------------
    // Helper methods
    // -------------------------------------------------------------------------

    /**
     * Records a started import run so transactions can reference it.
     */
    protected String startRun() {
        String id = UUID.randomUUID().toString();
        runs.start(ImportRun.builder(id, "/tmp/statement.csv", Instant.now()).build());
        return id;
    }

    protected PendingTransaction pending(int rowNumber, String accountId, String date, String amount,
                                         String description) {
        return new PendingTransaction(rowNumber, accountId, LocalDate.parse(date), new BigDecimal(amount),
                description, null, UUID.randomUUID().toString().replace("-", "") + "00000000000000000000000000000000");
    }

    protected PendingTransaction pending(int rowNumber, String accountId, String date, String amount,
                                         String description, String fingerprint) {
        return new PendingTransaction(rowNumber, accountId, LocalDate.parse(date), new BigDecimal(amount),
                description, null, fingerprint);
    }

    protected int countRows(String table) throws SQLException {
        try (Connection con = database.getConnection();
             Statement stmt = con.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getInt(1);
        }
    }

    protected BigDecimal balanceOf(String accountId) {
        return accounts.findById(accountId).get().getBalance();
    }
}
