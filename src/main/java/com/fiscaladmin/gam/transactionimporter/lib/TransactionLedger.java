package com.fiscaladmin.gam.transactionimporter.lib;

import com.fiscaladmin.gam.transactionimporter.archive.Archiver;
import com.fiscaladmin.gam.transactionimporter.config.ImporterConfig;
import com.fiscaladmin.gam.transactionimporter.export.TransactionCsvExporter;
import com.fiscaladmin.gam.transactionimporter.model.Account;
import com.fiscaladmin.gam.transactionimporter.model.ImportRun;
import com.fiscaladmin.gam.transactionimporter.model.Transaction;
import com.fiscaladmin.gam.transactionimporter.model.TransactionFilter;
import com.fiscaladmin.gam.transactionimporter.parser.SourceKind;
import com.fiscaladmin.gam.transactionimporter.persister.AccountLocks;
import com.fiscaladmin.gam.transactionimporter.persister.AccountRepository;
import com.fiscaladmin.gam.transactionimporter.persister.Database;
import com.fiscaladmin.gam.transactionimporter.persister.ImportRunRepository;
import com.fiscaladmin.gam.transactionimporter.persister.TransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for callers (UI, reporting, scripts): imports plus the queries and
 * edits they need over the store.
 * <p>
 * Open with {@link #open(ImporterConfig)} and close when done; closing stops the
 * import workers and the connection pool.
 */
public class TransactionLedger implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(TransactionLedger.class);

    private final ImporterConfig config;
    private final Database database;
    private final AccountRepository accounts;
    private final TransactionRepository transactions;
    private final ImportRunRepository runs;
    private final Archiver archiver;
    private final TransactionImporter importer;

    TransactionLedger(ImporterConfig config, Database database, AccountRepository accounts,
                      TransactionRepository transactions, ImportRunRepository runs, Archiver archiver,
                      TransactionImporter importer) {
        this.config = config;
        this.database = database;
        this.accounts = accounts;
        this.transactions = transactions;
        this.runs = runs;
        this.archiver = archiver;
        this.importer = importer;
    }

    /**
     * Opens the store described by the configuration, creating the schema if needed.
     */
    public static TransactionLedger open(ImporterConfig config) {
        Database database = Database.open(config.getJdbcUrl(), config.getJdbcUser(), config.getJdbcPassword(),
                config.getWorkerThreads() + 2);
        AccountLocks locks = new AccountLocks(config.getLockTimeout());
        AccountRepository accounts = new AccountRepository(database.getDataSource(), locks, config.getClock());
        TransactionRepository transactions = new TransactionRepository(database.getDataSource(), locks);
        ImportRunRepository runs = new ImportRunRepository(database.getDataSource());
        Archiver archiver = new Archiver(config.getArchiveRoot(), config.getClock(), config.getArchiveAttempts());
        TransactionImporter importer = new TransactionImporter(config, accounts, transactions, runs, archiver);
        return new TransactionLedger(config, database, accounts, transactions, runs, archiver, importer);
    }

    // -------------------------------------------------------------------------
    // Import
    // -------------------------------------------------------------------------

    public List<ImportRun> importFiles(List<Path> files) {
        return importer.importFiles(files);
    }

    public ImportRun importFile(Path file) {
        return importer.importFile(file);
    }

    /**
     * Cancels in-flight imports that have not started committing.
     */
    public int cancelImports() {
        return importer.cancel();
    }

    /**
     * Lists statement files waiting in a drop directory: {@code .csv} and {@code .xlsx}
     * files directly inside it, sorted by name. Subdirectories (including an archive
     * kept under the drop directory) are not searched.
     */
    public List<Path> listPendingFiles(Path watchDir) throws IOException {
        List<Path> pending = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(watchDir)) {
            for (Path p : stream) {
                if (Files.isRegularFile(p) && SourceKind.of(p).isPresent()) {
                    pending.add(p);
                }
            }
        }
        pending.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
        return pending;
    }

    /**
     * Imports every pending file of a drop directory.
     */
    public List<ImportRun> importPending(Path watchDir) throws IOException {
        List<Path> pending = listPendingFiles(watchDir);
        LOG.info("Found {} pending file(s) in {}", pending.size(), watchDir);
        return importFiles(pending);
    }

    public List<ImportRun> listImportRuns() {
        return runs.listAll();
    }

    /**
     * Lists statement files in the archive, oldest first.
     */
    public List<Path> listArchivedFiles() throws IOException {
        return archiver.listArchived();
    }

    /**
     * Moves an archived file back into a drop directory for re-import. Transactions
     * already imported from it stay; re-importing counts them as duplicates.
     *
     * @return where the file now is
     */
    public Path restoreArchivedFile(Path archivedFile, Path watchDir) throws IOException {
        return archiver.restore(archivedFile, watchDir);
    }

    // -------------------------------------------------------------------------
    // Transactions
    // -------------------------------------------------------------------------

    /**
     * Lists transactions newest first.
     */
    public List<Transaction> listTransactions(TransactionFilter filter) {
        return transactions.list(filter);
    }

    public void updateCategory(String transactionId, String category) {
        transactions.updateCategory(transactionId, category);
    }

    /**
     * Deletes every transaction and resets balances. Accounts and import history are kept.
     */
    public int deleteAllTransactions() {
        return transactions.deleteAll();
    }

    public byte[] exportTransactions(TransactionFilter filter) {
        Map<String, String> names = new HashMap<>();
        for (Account account : accounts.listAll()) {
            names.put(account.getId(), account.getDisplayName());
        }
        return TransactionCsvExporter.export(transactions.list(filter), names);
    }

    // -------------------------------------------------------------------------
    // Accounts
    // -------------------------------------------------------------------------

    public Account createAccount(String displayName, String institutionId) {
        return accounts.create(displayName, institutionId);
    }

    public Account updateAccount(String accountId, String displayName, String institutionId) {
        return accounts.update(accountId, displayName, institutionId);
    }

    /**
     * Deletes an account together with its transactions.
     */
    public void deleteAccount(String accountId) {
        accounts.delete(accountId);
    }

    public Optional<Account> getAccount(String accountId) {
        return accounts.findById(accountId);
    }

    public List<Account> listAccounts() {
        return accounts.listAll();
    }

    public ImporterConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        try {
            importer.close();
        } finally {
            database.close();
        }
    }
}
