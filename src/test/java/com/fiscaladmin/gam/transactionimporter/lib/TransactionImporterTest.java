package com.fiscaladmin.gam.transactionimporter.lib;

import com.fiscaladmin.gam.transactionimporter.archive.Archiver;
import com.fiscaladmin.gam.transactionimporter.config.ImporterConfig;
import com.fiscaladmin.gam.transactionimporter.model.Account;
import com.fiscaladmin.gam.transactionimporter.model.ImportErrorKind;
import com.fiscaladmin.gam.transactionimporter.model.ImportOutcome;
import com.fiscaladmin.gam.transactionimporter.model.ImportRun;
import com.fiscaladmin.gam.transactionimporter.model.ImportStage;
import com.fiscaladmin.gam.transactionimporter.model.RowError;
import com.fiscaladmin.gam.transactionimporter.model.RowErrorCode;
import com.fiscaladmin.gam.transactionimporter.model.Transaction;
import com.fiscaladmin.gam.transactionimporter.model.TransactionFilter;
import com.fiscaladmin.gam.transactionimporter.persister.StorageException;
import com.fiscaladmin.gam.transactionimporter.persister.StoreTestBase;
import com.fiscaladmin.gam.transactionimporter.persister.TransactionRepository;
import com.fiscaladmin.gam.transactionimporter.validation.AccountPolicy;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

/**
 * End-to-end tests of the import pipeline against an in-memory store and real files.
 */
public class TransactionImporterTest extends StoreTestBase {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-30T12:00:00Z"), ZoneOffset.UTC);

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Path inbox;
    private Path archiveRoot;
    private ImporterConfig config;
    private TransactionImporter importer;

    @Before
    public void setUp() throws IOException {
        inbox = tmp.newFolder("inbox").toPath();
        archiveRoot = tmp.getRoot().toPath().resolve("archive");
        config = ImporterConfig.builder()
                .archiveRoot(archiveRoot)
                .workerThreads(4)
                .fileTimeout(Duration.ofSeconds(30))
                .lockTimeout(Duration.ofSeconds(5))
                .clock(CLOCK)
                .build();
        importer = newImporter(config, transactions);
    }

    @After
    public void tearDown() {
        importer.close();
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private TransactionImporter newImporter(ImporterConfig cfg, TransactionRepository repo) {
        return new TransactionImporter(cfg, accounts, repo, runs,
                new Archiver(cfg.getArchiveRoot(), cfg.getClock(), cfg.getArchiveAttempts()));
    }

    /**
     * Copies a fixture from {@code test-data/} into the inbox under the given name.
     */
    private Path fixture(String resource, String targetName) throws IOException {
        Path target = inbox.resolve(targetName);
        try (InputStream in = getClass().getResourceAsStream("/test-data/" + resource)) {
            assertNotNull("Missing test resource " + resource, in);
            Files.copy(in, target);
        }
        return target;
    }

    private Path fixture(String resource) throws IOException {
        return fixture(resource, resource);
    }

    private Path csv(String name, String content) throws IOException {
        Path file = inbox.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private BigDecimal balanceOfAccount(String name) {
        Account account = accounts.findByName(name).orElseThrow(() -> new AssertionError("No account " + name));
        return account.getBalance();
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals("amount", 0, new BigDecimal(expected).compareTo(actual));
    }

    private void assertRecorded(ImportRun run) {
        ImportRun stored = runs.findById(run.getId()).orElseThrow(() -> new AssertionError("Run not stored"));
        assertTrue(stored.isFinalized());
        assertEquals(run.getOutcome(), stored.getOutcome());
        assertEquals(run.getErrorKind(), stored.getErrorKind());
        assertEquals(run.getRowsSeen(), stored.getRowsSeen());
        assertEquals(run.getRowsImported(), stored.getRowsImported());
        assertEquals(run.getRowsDuplicate(), stored.getRowsDuplicate());
        assertEquals(run.getRowsInvalid(), stored.getRowsInvalid());
    }

    // ── Happy path ───────────────────────────────────────────────────────

    @Test
    public void importsPncStatementAndArchivesIt() throws Exception {
        Path file = fixture("pnc_checking.csv");

        ImportRun run = importer.importFile(file);

        assertEquals(ImportOutcome.SUCCEEDED, run.getOutcome());
        assertEquals(ImportStage.DONE, run.getStage());
        assertNull(run.getErrorKind());
        assertEquals("PNC", run.getProfileId());
        assertEquals(4, run.getRowsSeen());
        assertEquals(4, run.getRowsImported());
        assertEquals(0, run.getRowsDuplicate());
        assertEquals(0, run.getRowsInvalid());
        assertNotNull(run.getCompletedAt());
        assertRecorded(run);

        assertAmount("3334.45", balanceOfAccount("PNC Checking"));
        assertEquals(4, countRows("transactions"));

        Path archived = archiveRoot.resolve("2024/06/30/pnc_checking.csv");
        assertEquals(archived.toString(), run.getArchivedPath());
        assertTrue(Files.exists(archived));
        assertFalse(Files.exists(file));
    }

    @Test
    public void mapsEveryBuiltInProfile() throws Exception {
        List<ImportRun> results = importer.importFiles(Arrays.asList(
                fixture("chase_card.csv"), fixture("capital_one.csv")));

        assertEquals("CHASE", results.get(0).getProfileId());
        assertEquals(3, results.get(0).getRowsImported());
        assertAmount("-300.00", balanceOfAccount("Chase SW"));

        assertEquals("CAPITAL_ONE", results.get(1).getProfileId());
        assertEquals(2, results.get(1).getRowsImported());
        assertAmount("187.01", balanceOfAccount("Capital One"));

        List<Transaction> chase = transactions.list(TransactionFilter.forAccount(
                accounts.findByName("Chase SW").get().getId()));
        boolean memoAppended = false;
        for (Transaction t : chase) {
            memoAppended |= "AIRLINE - Seat upgrade".equals(t.getDescription());
        }
        assertTrue(memoAppended);
    }

    @Test
    public void chaseCardsAreKeptApartByFileName() throws Exception {
        List<ImportRun> results = importer.importFiles(Arrays.asList(
                fixture("chase_card.csv", "chase_sw.csv"),
                fixture("chase_card.csv", "chase_star_wars.csv")));

        for (ImportRun run : results) {
            assertEquals(ImportOutcome.SUCCEEDED, run.getOutcome());
            assertEquals(3, run.getRowsImported());
            assertEquals(0, run.getRowsDuplicate());
        }
        assertAmount("-300.00", balanceOfAccount("Chase SW"));
        assertAmount("-300.00", balanceOfAccount("Chase Star Wars"));
        assertEquals(6, countRows("transactions"));
    }

    @Test
    public void headerOnlyFileSucceedsWithNothingImported() throws Exception {
        ImportRun run = importer.importFile(fixture("header_only.csv"));

        assertEquals(ImportOutcome.SUCCEEDED, run.getOutcome());
        assertEquals(0, run.getRowsSeen());
        assertEquals(0, run.getRowsImported());
        assertNotNull(run.getArchivedPath());
    }

    @Test
    public void importsSpreadsheet() throws Exception {
        Path file = inbox.resolve("export.xlsx");
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd"));
            Sheet sheet = workbook.createSheet();
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("Date");
            header.createCell(1).setCellValue("Description");
            header.createCell(2).setCellValue("Amount");
            Object[][] data = {
                    {LocalDate.of(2024, 6, 10), "HARDWARE STORE", -42.10},
                    {LocalDate.of(2024, 6, 11), "REFUND", 12.0},
            };
            for (int i = 0; i < data.length; i++) {
                Row row = sheet.createRow(i + 1);
                Cell date = row.createCell(0);
                date.setCellValue((LocalDate) data[i][0]);
                date.setCellStyle(dateStyle);
                row.createCell(1).setCellValue((String) data[i][1]);
                row.createCell(2).setCellValue((Double) data[i][2]);
            }
            try (OutputStream os = Files.newOutputStream(file)) {
                workbook.write(os);
            }
        }

        ImportRun run = importer.importFile(file);

        assertEquals(ImportOutcome.SUCCEEDED, run.getOutcome());
        assertEquals("GENERIC", run.getProfileId());
        assertEquals(2, run.getRowsImported());
        assertAmount("-30.10", balanceOfAccount("Imported"));
    }

    // ── Duplicates ───────────────────────────────────────────────────────

    @Test
    public void reimportingTheSameStatementChangesNothing() throws Exception {
        importer.importFile(fixture("pnc_checking.csv"));
        BigDecimal balance = balanceOfAccount("PNC Checking");

        ImportRun again = importer.importFile(fixture("pnc_checking.csv"));

        assertEquals(ImportOutcome.SUCCEEDED, again.getOutcome());
        assertEquals(4, again.getRowsSeen());
        assertEquals(0, again.getRowsImported());
        assertEquals(4, again.getRowsDuplicate());
        assertEquals(4, countRows("transactions"));
        assertEquals(balance, balanceOfAccount("PNC Checking"));
        assertTrue(again.getArchivedPath().endsWith("pnc_checking_1.csv"));
        assertRecorded(again);
    }

    @Test
    public void duplicateRowsWithinOneFileAreImportedOnce() throws Exception {
        ImportRun run = importer.importFile(fixture("duplicate_rows.csv"));

        assertEquals(ImportOutcome.SUCCEEDED, run.getOutcome());
        assertEquals(2, run.getRowsSeen());
        assertEquals(1, run.getRowsImported());
        assertEquals(1, run.getRowsDuplicate());
        assertEquals(RowErrorCode.DUPLICATE, run.getRowErrors().get(0).getCode());
        assertEquals(2, run.getRowErrors().get(0).getRowNumber());
        assertAmount("-4.50", balanceOfAccount("Imported"));
    }

    @Test
    public void sameRowsInParallelFilesAreImportedOnce() throws Exception {
        String content = "Date,Description,Amount\n"
                + "2024-06-01,RENT,-1200.00\n"
                + "2024-06-02,GYM,-45.00\n"
                + "2024-06-03,SALARY,3000.00\n";
        List<Path> files = Arrays.asList(csv("copy_a.csv", content), csv("copy_b.csv", content),
                csv("copy_c.csv", content));

        List<ImportRun> results = importer.importFiles(files);

        int imported = 0;
        int duplicates = 0;
        for (ImportRun run : results) {
            assertEquals(ImportOutcome.SUCCEEDED, run.getOutcome());
            imported += run.getRowsImported();
            duplicates += run.getRowsDuplicate();
        }
        assertEquals(3, imported);
        assertEquals(6, duplicates);
        assertEquals(3, countRows("transactions"));
        assertAmount("1755.00", balanceOfAccount("Imported"));
    }

    // ── Bad rows and bad files ───────────────────────────────────────────

    @Test
    public void invalidRowsAreCountedAndSkipped() throws Exception {
        ImportRun run = importer.importFile(fixture("mixed_quality.csv"));

        assertEquals(ImportOutcome.PARTIALLY_SUCCEEDED, run.getOutcome());
        assertEquals(7, run.getRowsSeen());
        assertEquals(2, run.getRowsImported());
        assertEquals(5, run.getRowsInvalid());
        assertEquals(0, run.getRowsDuplicate());
        assertNotNull(run.getArchivedPath());
        assertRecorded(run);

        List<RowErrorCode> codes = new ArrayList<>();
        for (RowError error : run.getRowErrors()) {
            codes.add(error.getCode());
        }
        assertEquals(Arrays.asList(
                RowErrorCode.EMPTY_DESCRIPTION,
                RowErrorCode.UNPARSEABLE_DATE,
                RowErrorCode.ZERO_AMOUNT,
                RowErrorCode.AMOUNT_OUT_OF_RANGE,
                RowErrorCode.DATE_IN_FUTURE), codes);
        assertEquals(2, run.getRowErrors().get(0).getRowNumber());

        assertAmount("-19.75", balanceOfAccount("Everyday"));
    }

    @Test
    public void unrecognisedFileFailsAndStaysInPlace() throws Exception {
        Path file = fixture("unknown_format.csv");

        ImportRun run = importer.importFile(file);

        assertEquals(ImportOutcome.FAILED, run.getOutcome());
        assertEquals(ImportStage.FAILED, run.getStage());
        assertEquals(ImportErrorKind.FILE_ERROR, run.getErrorKind());
        assertTrue(run.getErrorMessage().contains("Foo,Bar,Baz"));
        assertNull(run.getArchivedPath());
        assertTrue(Files.exists(file));
        assertRecorded(run);
    }

    @Test
    public void fileWithOnlyInvalidRowsIsDoneAndArchived() throws Exception {
        Path file = fixture("all_invalid.csv");

        ImportRun run = importer.importFile(file);

        assertEquals(ImportOutcome.PARTIALLY_SUCCEEDED, run.getOutcome());
        assertEquals(ImportStage.DONE, run.getStage());
        assertNull(run.getErrorKind());
        assertEquals(2, run.getRowsSeen());
        assertEquals(2, run.getRowsInvalid());
        assertEquals(0, run.getRowsImported());
        assertEquals(2, run.getRowErrors().size());
        assertFalse(Files.exists(file));
        assertTrue(Files.exists(archiveRoot.resolve("2024/06/30/all_invalid.csv")));
        assertTrue(accounts.listAll().isEmpty());
        assertRecorded(run);
    }

    @Test
    public void singleUnparseableRowDoesNotFailTheFile() throws Exception {
        Path file = csv("coffee.csv", "Date,Description,Amount\nnot-a-date,COFFEE,-4.50\n");

        ImportRun run = importer.importFile(file);

        assertEquals(ImportOutcome.PARTIALLY_SUCCEEDED, run.getOutcome());
        assertEquals(ImportStage.DONE, run.getStage());
        assertEquals(RowErrorCode.UNPARSEABLE_DATE, run.getRowErrors().get(0).getCode());
        assertFalse(Files.exists(file));
    }

    @Test
    public void overlongCategoryOrAccountOnlyRejectsThoseRows() throws Exception {
        String longText = "x".repeat(300);
        Path file = csv("long_cells.csv", "Date,Description,Amount,Category,Account\n"
                + "2024-06-01,COFFEE,-4.50,Food,Everyday\n"
                + "2024-06-02,BOOKS,-12.00," + longText + ",Everyday\n"
                + "2024-06-03,LUNCH,-9.00,Food," + longText + "\n");

        ImportRun run = importer.importFile(file);

        assertEquals(ImportOutcome.PARTIALLY_SUCCEEDED, run.getOutcome());
        assertNull(run.getErrorKind());
        assertEquals(1, run.getRowsImported());
        assertEquals(2, run.getRowsInvalid());
        assertEquals(RowErrorCode.CATEGORY_TOO_LONG, run.getRowErrors().get(0).getCode());
        assertEquals(RowErrorCode.ACCOUNT_NAME_TOO_LONG, run.getRowErrors().get(1).getCode());
        assertEquals(1, accounts.listAll().size());
        assertAmount("-4.50", balanceOfAccount("Everyday"));
    }

    @Test
    public void alreadyArchivedPathFailsAsFileError() throws Exception {
        Path file = fixture("pnc_checking.csv");
        importer.importFile(file);

        ImportRun again = importer.importFile(file);

        assertEquals(ImportOutcome.FAILED, again.getOutcome());
        assertEquals(ImportErrorKind.FILE_ERROR, again.getErrorKind());
        assertEquals(4, countRows("transactions"));
    }

    @Test
    public void unsupportedExtensionFails() throws Exception {
        ImportRun run = importer.importFile(csv("notes.txt", "Date,Description,Amount\n2024-06-01,X,-1\n"));

        assertEquals(ImportOutcome.FAILED, run.getOutcome());
        assertEquals(ImportErrorKind.FILE_ERROR, run.getErrorKind());
    }

    @Test
    public void oneBadFileDoesNotStopTheBatch() throws Exception {
        List<Path> files = Arrays.asList(
                fixture("pnc_checking.csv"),
                fixture("unknown_format.csv"),
                fixture("chase_card.csv"),
                fixture("mixed_quality.csv"));

        List<ImportRun> results = importer.importFiles(files);

        assertEquals(4, results.size());
        for (int i = 0; i < files.size(); i++) {
            assertEquals(files.get(i).toString(), results.get(i).getSourcePath());
        }
        assertEquals(ImportOutcome.SUCCEEDED, results.get(0).getOutcome());
        assertEquals(ImportOutcome.FAILED, results.get(1).getOutcome());
        assertEquals(ImportOutcome.SUCCEEDED, results.get(2).getOutcome());
        assertEquals(ImportOutcome.PARTIALLY_SUCCEEDED, results.get(3).getOutcome());
        assertEquals(4, runs.listAll().size());

        Map<String, BigDecimal> sums = transactions.sumByAccount();
        for (Account account : accounts.listAll()) {
            assertAmount(sums.get(account.getId()).toPlainString(), account.getBalance());
        }
    }

    // ── Account policy ───────────────────────────────────────────────────

    @Test
    public void rejectPolicyOnlyImportsKnownAccounts() throws Exception {
        accounts.create("Everyday", "generic");
        TransactionImporter strict = newImporter(config.toBuilder().accountPolicy(AccountPolicy.REJECT).build(),
                transactions);
        try {
            ImportRun run = strict.importFile(csv("two_accounts.csv", "Date,Description,Amount,Account\n"
                    + "2024-06-01,LUNCH,-12.00,Everyday\n"
                    + "2024-06-02,DINNER,-30.00,Stranger\n"));

            assertEquals(ImportOutcome.PARTIALLY_SUCCEEDED, run.getOutcome());
            assertEquals(1, run.getRowsImported());
            assertEquals(RowErrorCode.UNKNOWN_ACCOUNT, run.getRowErrors().get(0).getCode());
            assertFalse(accounts.findByName("Stranger").isPresent());
        } finally {
            strict.close();
        }
    }

    // ── Failures during processing ───────────────────────────────────────

    @Test
    public void storageFailureLeavesNothingPersisted() throws Exception {
        TransactionRepository failing = spy(transactions);
        doThrow(new StorageException("disk full")).when(failing).commitBatch(any(), any());
        TransactionImporter broken = newImporter(config, failing);
        Path file = fixture("pnc_checking.csv");
        try {
            ImportRun run = broken.importFile(file);

            assertEquals(ImportOutcome.FAILED, run.getOutcome());
            assertEquals(ImportErrorKind.STORAGE_ERROR, run.getErrorKind());
            assertEquals(0, run.getRowsImported());
            assertRecorded(run);
        } finally {
            broken.close();
        }
        assertEquals(0, countRows("transactions"));
        assertEquals(0, balanceOfAccount("PNC Checking").signum());
        assertTrue(Files.exists(file));
    }

    @Test
    public void archiveFailureStillCommits() throws Exception {
        Path blocked = tmp.newFile("not-a-directory").toPath();
        ImporterConfig cfg = config.toBuilder().archiveRoot(blocked).archiveAttempts(1).build();
        TransactionImporter noArchive = newImporter(cfg, transactions);
        Path file = fixture("pnc_checking.csv");
        try {
            ImportRun run = noArchive.importFile(file);

            assertEquals(ImportOutcome.PARTIALLY_SUCCEEDED, run.getOutcome());
            assertEquals(ImportErrorKind.ARCHIVE_ERROR, run.getErrorKind());
            assertNotNull(run.getWarning());
            assertNull(run.getArchivedPath());
            assertEquals(4, run.getRowsImported());
        } finally {
            noArchive.close();
        }
        assertEquals(4, countRows("transactions"));
        assertTrue(Files.exists(file));
    }

    @Test
    public void slowFileTimesOutWithNothingPersisted() throws Exception {
        TransactionRepository slow = spy(transactions);
        doAnswer(invocation -> {
            Thread.sleep(1500);
            return invocation.callRealMethod();
        }).when(slow).loadFingerprints(anyCollection());
        TransactionImporter impatient = newImporter(config.toBuilder().fileTimeout(Duration.ofMillis(200)).build(),
                slow);
        Path file = fixture("pnc_checking.csv");
        ImportRun run;
        try {
            run = impatient.importFile(file);
        } finally {
            impatient.close();
        }

        assertEquals(ImportOutcome.FAILED, run.getOutcome());
        assertEquals(ImportErrorKind.TIMEOUT, run.getErrorKind());
        assertRecorded(run);
        assertEquals(0, countRows("transactions"));
        assertTrue(Files.exists(file));
    }

    @Test
    public void cancelStopsFilesThatHaveNotCommitted() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        TransactionRepository blocking = spy(transactions);
        doAnswer(invocation -> {
            entered.countDown();
            release.await(10, TimeUnit.SECONDS);
            return invocation.callRealMethod();
        }).when(blocking).loadFingerprints(anyCollection());
        TransactionImporter cancellable = newImporter(config, blocking);
        Path file = fixture("pnc_checking.csv");
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<List<ImportRun>> pending = caller.submit(() -> cancellable.importFiles(Arrays.asList(file)));
            assertTrue(entered.await(10, TimeUnit.SECONDS));

            assertEquals(1, cancellable.cancel());
            release.countDown();

            ImportRun run = pending.get(10, TimeUnit.SECONDS).get(0);
            assertEquals(ImportOutcome.FAILED, run.getOutcome());
            assertEquals(ImportErrorKind.CANCELLED, run.getErrorKind());
            assertRecorded(run);
        } finally {
            release.countDown();
            caller.shutdownNow();
            cancellable.close();
        }
        assertEquals(0, countRows("transactions"));
        assertEquals(0, cancellable.cancel());
    }

    @Test
    public void balancesMatchTransactionSums() throws SQLException, IOException {
        importer.importFiles(Arrays.asList(fixture("pnc_checking.csv"), fixture("mixed_quality.csv"),
                fixture("capital_one.csv")));
        importer.importFile(fixture("pnc_checking.csv", "pnc_again.csv"));

        Map<String, BigDecimal> sums = transactions.sumByAccount();
        assertEquals(3, accounts.listAll().size());
        for (Account account : accounts.listAll()) {
            assertAmount(sums.get(account.getId()).toPlainString(), account.getBalance());
        }
        assertEquals(8, countRows("transactions"));
    }
}
