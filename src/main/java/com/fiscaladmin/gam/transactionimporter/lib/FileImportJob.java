package com.fiscaladmin.gam.transactionimporter.lib;

import com.fiscaladmin.gam.transactionimporter.archive.Archiver;
import com.fiscaladmin.gam.transactionimporter.config.ImporterConfig;
import com.fiscaladmin.gam.transactionimporter.dedup.DeduplicationChecker;
import com.fiscaladmin.gam.transactionimporter.dedup.DeduplicationResult;
import com.fiscaladmin.gam.transactionimporter.mapping.BankProfile;
import com.fiscaladmin.gam.transactionimporter.mapping.MappingResult;
import com.fiscaladmin.gam.transactionimporter.mapping.ProfileMapper;
import com.fiscaladmin.gam.transactionimporter.mapping.TransactionDraft;
import com.fiscaladmin.gam.transactionimporter.model.ImportErrorKind;
import com.fiscaladmin.gam.transactionimporter.model.ImportOutcome;
import com.fiscaladmin.gam.transactionimporter.model.ImportRun;
import com.fiscaladmin.gam.transactionimporter.model.ImportStage;
import com.fiscaladmin.gam.transactionimporter.model.RowError;
import com.fiscaladmin.gam.transactionimporter.model.RowErrorCode;
import com.fiscaladmin.gam.transactionimporter.parser.DetectionResult;
import com.fiscaladmin.gam.transactionimporter.parser.FormatDetector;
import com.fiscaladmin.gam.transactionimporter.parser.RawRow;
import com.fiscaladmin.gam.transactionimporter.parser.StatementContent;
import com.fiscaladmin.gam.transactionimporter.parser.StatementReader;
import com.fiscaladmin.gam.transactionimporter.persister.AccountRepository;
import com.fiscaladmin.gam.transactionimporter.persister.CommitResult;
import com.fiscaladmin.gam.transactionimporter.persister.ImportRunRepository;
import com.fiscaladmin.gam.transactionimporter.persister.StorageException;
import com.fiscaladmin.gam.transactionimporter.persister.TransactionRepository;
import com.fiscaladmin.gam.transactionimporter.validation.PolicyAccountResolver;
import com.fiscaladmin.gam.transactionimporter.validation.TransactionValidator;
import com.fiscaladmin.gam.transactionimporter.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Imports one file: detect, map, validate, de-duplicate, commit, archive.
 * <p>
 * Exactly one party finalizes the job's {@link ImportRun}. A gate decides who:
 * <ul>
 *   <li>{@code OPEN}: the worker is before its commit. A timeout or cancellation
 *       may close the gate ({@code ABANDONED}) and finalize the run as FAILED; the
 *       worker then stops at its next checkpoint without touching the store</li>
 *   <li>{@code COMMITTING}: the worker has claimed the commit. Timeouts and
 *       cancellation no longer apply; the run reports what actually happened</li>
 *   <li>{@code FINISHING}: the worker is finalizing</li>
 * </ul>
 */
class FileImportJob implements Callable<ImportRun> {

    private static final Logger LOG = LoggerFactory.getLogger(FileImportJob.class);

    private static final int OPEN = 0;
    private static final int COMMITTING = 1;
    private static final int FINISHING = 2;
    private static final int ABANDONED = 3;

    private final Path file;
    private final ImportRun started;
    private final ImporterConfig config;
    private final AccountRepository accounts;
    private final TransactionRepository transactions;
    private final ImportRunRepository runs;
    private final Archiver archiver;
    private final TransactionValidator validator;
    private final ScheduledExecutorService watchdog;

    private final AtomicInteger gate = new AtomicInteger(OPEN);
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile Future<?> task;
    private volatile ImportRun result;
    private volatile ImportStage stage = ImportStage.DETECTING;
    private volatile String profileId;
    private volatile int rowsSeen;

    FileImportJob(Path file, ImportRun started, ImporterConfig config, AccountRepository accounts,
                  TransactionRepository transactions, ImportRunRepository runs, Archiver archiver,
                  TransactionValidator validator, ScheduledExecutorService watchdog) {
        this.file = file;
        this.started = started;
        this.config = config;
        this.accounts = accounts;
        this.transactions = transactions;
        this.runs = runs;
        this.archiver = archiver;
        this.validator = validator;
        this.watchdog = watchdog;
    }

    /**
     * Associates the job with the task that runs it, so abandonment can cancel the task.
     */
    void bind(Future<?> task) {
        this.task = task;
    }

    Path getFile() {
        return file;
    }

    @Override
    public ImportRun call() {
        long timeoutMs = config.getFileTimeout().toMillis();
        ScheduledFuture<?> timer = watchdog.schedule(() -> {
            if (abandon(ImportErrorKind.TIMEOUT, "Timed out after " + timeoutMs + " ms during " + stage)) {
                LOG.warn("Import of {} timed out during {}", file.getFileName(), stage);
            }
        }, timeoutMs, TimeUnit.MILLISECONDS);
        try {
            return run();
        } finally {
            timer.cancel(false);
        }
    }

    private ImportRun run() {
        ImportRun.Builder run = started.toBuilder();
        List<RowError> rowErrors = new ArrayList<>();
        try {
            // 1. Detect
            if (!checkpoint(ImportStage.DETECTING)) {
                return awaitResult();
            }
            DetectionResult detection = FormatDetector.detect(file, config.getProfiles());
            if (!detection.isRecognised()) {
                return fail(run, ImportErrorKind.FILE_ERROR, detection.getReason());
            }
            BankProfile profile = detection.getProfile().get();
            profileId = profile.getId();
            run.profileId(profileId);

            // 2. Read and map
            if (!checkpoint(ImportStage.MAPPING)) {
                return awaitResult();
            }
            StatementContent content = StatementReader.read(file);
            rowsSeen = content.getRows().size();
            run.rowsSeen(rowsSeen);
            String fileAccount = profile.accountNameFor(file.getFileName().toString());
            List<TransactionDraft> drafts = new ArrayList<>();
            for (RawRow row : content.getRows()) {
                MappingResult mapped = ProfileMapper.map(row, profile, fileAccount);
                if (mapped.isSuccess()) {
                    drafts.add(mapped.getDraft());
                } else {
                    rowErrors.add(mapped.getError());
                }
            }
            LOG.info("Mapped {} of {} rows from {} with profile {} into account {}", drafts.size(), rowsSeen,
                    file.getFileName(), profileId, fileAccount);

            // 3. Validate
            if (!checkpoint(ImportStage.VALIDATING)) {
                return awaitResult();
            }
            ValidationResult validation = validator.validate(drafts,
                    new PolicyAccountResolver(accounts, config.getAccountPolicy()));
            rowErrors.addAll(validation.getErrors());
            int invalid = rowErrors.size();
            run.rowsInvalid(invalid);

            // 4. De-duplicate
            if (!checkpoint(ImportStage.DEDUPLICATING)) {
                return awaitResult();
            }
            DeduplicationResult dedup = DeduplicationChecker.check(validation.getValid(), transactions);
            rowErrors.addAll(dedup.getDuplicates());

            // 5. Commit; from here on the run reports what actually happened
            stage = ImportStage.PERSISTING;
            if (!gate.compareAndSet(OPEN, COMMITTING)) {
                return awaitResult();
            }
            CommitResult commit = transactions.commitBatch(started.getId(), dedup.getSurvivors());
            for (Integer rowNumber : commit.getLateDuplicates()) {
                rowErrors.add(new RowError(rowNumber, RowErrorCode.DUPLICATE,
                        "Committed by a concurrent import"));
            }
            run.rowsImported(commit.getInsertedCount())
                    .rowsDuplicate(dedup.getDuplicateCount() + commit.getLateDuplicates().size())
                    .rowErrors(sorted(rowErrors));

            // 6. Archive; a failure here downgrades the outcome but never undoes the commit
            stage = ImportStage.ARCHIVING;
            ImportOutcome outcome = invalid > 0 ? ImportOutcome.PARTIALLY_SUCCEEDED : ImportOutcome.SUCCEEDED;
            try {
                Path archived = archiver.archive(file);
                run.archivedPath(archived.toString());
            } catch (IOException e) {
                LOG.warn("Imported {} but could not archive it", file.getFileName(), e);
                run.error(ImportErrorKind.ARCHIVE_ERROR, e.toString())
                        .warning("Imported but not archived: " + e.getMessage());
                outcome = ImportOutcome.PARTIALLY_SUCCEEDED;
            }

            return finish(run.outcome(outcome).stage(ImportStage.DONE));

        } catch (IOException e) {
            LOG.error("Cannot read {}", file, e);
            run.rowErrors(sorted(rowErrors));
            return fail(run, ImportErrorKind.FILE_ERROR, "Cannot read file: " + e);
        } catch (StorageException e) {
            LOG.error("Storage failure while importing {} during {}", file, stage, e);
            run.rowsImported(0).rowErrors(sorted(rowErrors));
            return fail(run, ImportErrorKind.STORAGE_ERROR, e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure while importing {} during {}", file, stage, e);
            run.rowsImported(0).rowErrors(sorted(rowErrors));
            return fail(run, ImportErrorKind.FILE_ERROR, "Unexpected error: " + e);
        }
    }

    /**
     * Records the stage and returns {@code false} if the job has been abandoned.
     */
    private boolean checkpoint(ImportStage next) {
        stage = next;
        return gate.get() == OPEN;
    }

    private ImportRun fail(ImportRun.Builder run, ImportErrorKind kind, String message) {
        LOG.warn("Import of {} failed during {}: {}", file.getFileName(), stage, message);
        return finish(run.outcome(ImportOutcome.FAILED).stage(ImportStage.FAILED)
                .error(kind, message + " (stage " + stage + ")"));
    }

    /**
     * Finalizes the run unless a timeout or cancellation already did.
     */
    private ImportRun finish(ImportRun.Builder run) {
        int state = gate.get();
        if (state == ABANDONED || !gate.compareAndSet(state, FINISHING)) {
            return awaitResult();
        }
        return publish(run.completedAt(Instant.now(config.getClock())).build());
    }

    /**
     * Closes the gate if the worker has not started committing and finalizes the run as FAILED.
     *
     * @return {@code true} if this call abandoned the job
     */
    boolean abandon(ImportErrorKind kind, String message) {
        if (!gate.compareAndSet(OPEN, ABANDONED)) {
            return false;
        }
        ImportRun.Builder run = started.toBuilder()
                .profileId(profileId)
                .rowsSeen(rowsSeen)
                .outcome(ImportOutcome.FAILED)
                .stage(ImportStage.FAILED)
                .error(kind, message)
                .completedAt(Instant.now(config.getClock()));
        publish(run.build());
        Future<?> t = task;
        if (t != null) {
            t.cancel(false);
        }
        return true;
    }

    /**
     * Finalizes a job whose worker died without finalizing, e.g. on an {@link Error}.
     */
    ImportRun failUnexpectedly(Throwable cause) {
        gate.set(FINISHING);
        return publish(started.toBuilder()
                .profileId(profileId)
                .rowsSeen(rowsSeen)
                .outcome(ImportOutcome.FAILED)
                .stage(ImportStage.FAILED)
                .error(ImportErrorKind.FILE_ERROR, "Unexpected error: " + cause)
                .completedAt(Instant.now(config.getClock()))
                .build());
    }

    private synchronized ImportRun publish(ImportRun run) {
        if (result != null) {
            return result;
        }
        try {
            runs.complete(run);
        } catch (StorageException e) {
            LOG.error("Cannot record outcome of {}; returning it unrecorded", file, e);
            run = run.toBuilder().warning("Outcome not recorded: " + e.getMessage()).build();
        }
        result = run;
        finished.countDown();
        LOG.info("Import of {} finished: {}", file.getFileName(), run);
        return run;
    }

    /**
     * Waits until the run has been finalized by whichever party owns it.
     */
    ImportRun awaitResult() {
        boolean interrupted = false;
        while (true) {
            try {
                finished.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return result;
    }

    private static List<RowError> sorted(List<RowError> errors) {
        List<RowError> copy = new ArrayList<>(errors);
        copy.sort(Comparator.comparingInt(RowError::getRowNumber));
        return copy;
    }
}
