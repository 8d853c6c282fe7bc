package com.fiscaladmin.gam.transactionimporter.lib;

import com.fiscaladmin.gam.transactionimporter.config.ImporterConfig;
import com.fiscaladmin.gam.transactionimporter.model.Account;
import com.fiscaladmin.gam.transactionimporter.model.ImportOutcome;
import com.fiscaladmin.gam.transactionimporter.model.ImportRun;
import com.fiscaladmin.gam.transactionimporter.model.Transaction;
import com.fiscaladmin.gam.transactionimporter.model.TransactionFilter;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.Assert.*;

public class TransactionLedgerTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Path watchDir;
    private TransactionLedger ledger;

    @Before
    public void setUp() throws IOException {
        watchDir = tmp.newFolder("csv_files").toPath();
        ImporterConfig config = ImporterConfig.builder()
                .jdbc("jdbc:h2:mem:ledger-" + UUID.randomUUID(), "sa", "")
                .archiveRoot(watchDir.resolve("csv_files_added"))
                .workerThreads(2)
                .clock(Clock.fixed(Instant.parse("2024-06-30T12:00:00Z"), ZoneOffset.UTC))
                .build();
        ledger = TransactionLedger.open(config);
    }

    @After
    public void tearDown() {
        ledger.close();
    }

    // ---- Helper methods ----

    private Path fixture(String resource) throws IOException {
        Path target = watchDir.resolve(resource);
        try (InputStream in = getClass().getResourceAsStream("/test-data/" + resource)) {
            assertNotNull("Missing test resource " + resource, in);
            Files.copy(in, target);
        }
        return target;
    }

    private Map<String, BigDecimal> balancesByName() {
        Map<String, BigDecimal> balances = new HashMap<>();
        for (Account account : ledger.listAccounts()) {
            balances.put(account.getDisplayName(), account.getBalance());
        }
        return balances;
    }

    // ---- Drop directory ----

    @Test
    public void pendingFilesAreStatementsDirectlyInTheDirectory() throws Exception {
        fixture("pnc_checking.csv");
        fixture("chase_card.csv");
        Files.write(watchDir.resolve("notes.txt"), "x".getBytes(StandardCharsets.UTF_8));
        Files.write(watchDir.resolve("Book.XLSX"), new byte[0]);
        Path nested = Files.createDirectories(watchDir.resolve("csv_files_added/2024/06/01"));
        Files.write(nested.resolve("old.csv"), "Date,Description,Amount\n".getBytes(StandardCharsets.UTF_8));

        List<Path> pending = ledger.listPendingFiles(watchDir);

        assertEquals(3, pending.size());
        assertEquals("Book.XLSX", pending.get(0).getFileName().toString());
        assertEquals("chase_card.csv", pending.get(1).getFileName().toString());
        assertEquals("pnc_checking.csv", pending.get(2).getFileName().toString());
    }

    @Test
    public void importPendingEmptiesTheDropDirectory() throws Exception {
        fixture("pnc_checking.csv");
        fixture("capital_one.csv");

        List<ImportRun> results = ledger.importPending(watchDir);

        assertEquals(2, results.size());
        for (ImportRun run : results) {
            assertEquals(ImportOutcome.SUCCEEDED, run.getOutcome());
        }
        assertTrue(ledger.listPendingFiles(watchDir).isEmpty());
        assertEquals(2, ledger.listImportRuns().size());
        assertTrue(Files.exists(watchDir.resolve("csv_files_added/2024/06/30/pnc_checking.csv")));
    }

    @Test
    public void archivedFileCanBeRestoredAndReimported() throws Exception {
        ledger.importFile(fixture("pnc_checking.csv"));
        List<Path> archived = ledger.listArchivedFiles();
        assertEquals(1, archived.size());

        Path restored = ledger.restoreArchivedFile(archived.get(0), watchDir);

        assertEquals(watchDir.resolve("pnc_checking.csv"), restored);
        assertTrue(ledger.listArchivedFiles().isEmpty());
        assertEquals(1, ledger.listPendingFiles(watchDir).size());

        ImportRun again = ledger.importPending(watchDir).get(0);
        assertEquals(ImportOutcome.SUCCEEDED, again.getOutcome());
        assertEquals(0, again.getRowsImported());
        assertEquals(4, again.getRowsDuplicate());
        assertEquals(1, ledger.listArchivedFiles().size());
    }

    @Test
    public void cancelWithNothingRunningCancelsNothing() throws Exception {
        ledger.importFile(fixture("capital_one.csv"));

        assertEquals(0, ledger.cancelImports());
        assertEquals(ImportOutcome.SUCCEEDED, ledger.listImportRuns().get(0).getOutcome());
    }

    // ---- Transactions ----

    @Test
    public void exportedTransactionsImportBackIdentically() throws Exception {
        ledger.importFiles(Arrays.asList(fixture("pnc_checking.csv"), fixture("mixed_quality.csv")));
        Map<String, BigDecimal> before = balancesByName();
        byte[] export = ledger.exportTransactions(TransactionFilter.all());

        int deleted = ledger.deleteAllTransactions();
        assertEquals(6, deleted);
        assertTrue(ledger.listTransactions(TransactionFilter.all()).isEmpty());

        Path exported = watchDir.resolve("export.csv");
        Files.write(exported, export);
        ImportRun run = ledger.importFile(exported);

        assertEquals(ImportOutcome.SUCCEEDED, run.getOutcome());
        assertEquals("GENERIC", run.getProfileId());
        assertEquals(6, run.getRowsImported());
        Map<String, BigDecimal> after = balancesByName();
        assertEquals(before.keySet(), after.keySet());
        for (String name : before.keySet()) {
            assertEquals(name, 0, before.get(name).compareTo(after.get(name)));
        }
    }

    @Test
    public void categoryCanBeEditedAndFiltered() throws Exception {
        ledger.importFile(fixture("pnc_checking.csv"));
        Transaction grocery = null;
        for (Transaction t : ledger.listTransactions(TransactionFilter.all())) {
            if (t.getDescription().equals("GROCERY OUTLET")) {
                grocery = t;
            }
        }
        assertNotNull(grocery);

        ledger.updateCategory(grocery.getId(), "Food");

        List<Transaction> food = ledger.listTransactions(TransactionFilter.all().withCategory("Food"));
        assertEquals(1, food.size());
        assertEquals(grocery.getId(), food.get(0).getId());
    }

    // ---- Accounts ----

    @Test
    public void accountLifecycle() {
        Account created = ledger.createAccount("Emergency Fund", "manual");
        assertTrue(ledger.getAccount(created.getId()).isPresent());

        Account renamed = ledger.updateAccount(created.getId(), "Rainy Day", null);
        assertEquals("Rainy Day", renamed.getDisplayName());

        ledger.deleteAccount(created.getId());
        assertFalse(ledger.getAccount(created.getId()).isPresent());
    }

    @Test
    public void deletingAnAccountRemovesItsTransactions() throws Exception {
        ledger.importFiles(Arrays.asList(fixture("pnc_checking.csv"), fixture("chase_card.csv")));
        Account chase = null;
        for (Account account : ledger.listAccounts()) {
            if (account.getDisplayName().equals("Chase SW")) {
                chase = account;
            }
        }
        assertNotNull(chase);

        ledger.deleteAccount(chase.getId());

        List<Transaction> remaining = ledger.listTransactions(TransactionFilter.all());
        assertEquals(4, remaining.size());
        for (Transaction t : remaining) {
            assertNotEquals(chase.getId(), t.getAccountId());
        }
        assertEquals(1, ledger.listAccounts().size());
    }
}
