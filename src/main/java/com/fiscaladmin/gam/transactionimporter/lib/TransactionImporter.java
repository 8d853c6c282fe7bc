package com.fiscaladmin.gam.transactionimporter.lib;

import com.fiscaladmin.gam.transactionimporter.archive.Archiver;
import com.fiscaladmin.gam.transactionimporter.config.ImporterConfig;
import com.fiscaladmin.gam.transactionimporter.model.ImportErrorKind;
import com.fiscaladmin.gam.transactionimporter.model.ImportOutcome;
import com.fiscaladmin.gam.transactionimporter.model.ImportRun;
import com.fiscaladmin.gam.transactionimporter.model.ImportStage;
import com.fiscaladmin.gam.transactionimporter.persister.AccountRepository;
import com.fiscaladmin.gam.transactionimporter.persister.ImportRunRepository;
import com.fiscaladmin.gam.transactionimporter.persister.StorageException;
import com.fiscaladmin.gam.transactionimporter.persister.TransactionRepository;
import com.fiscaladmin.gam.transactionimporter.validation.TransactionValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Import orchestrator.
 * <p>
 * Runs each file through detection, mapping, validation, de-duplication, commit and
 * archiving on a bounded worker pool. Every file yields exactly one finalized
 * {@link ImportRun}; one bad file never aborts the batch.
 * <p>
 * Orchestration flow per file:
 * <ol>
 *   <li>Record the run as started</li>
 *   <li>Detect the bank profile from the header row</li>
 *   <li>Read and map rows; mapping failures become row errors</li>
 *   <li>Validate drafts and resolve accounts</li>
 *   <li>Drop duplicates against the store and earlier rows of the file</li>
 *   <li>Commit the surviving rows and balance changes atomically</li>
 *   <li>Move the file to the archive</li>
 *   <li>Finalize the run</li>
 * </ol>
 * A file that exceeds the configured timeout, or is cancelled, before its commit
 * begins is finalized as FAILED and nothing of it is persisted.
 */
public class TransactionImporter implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(TransactionImporter.class);

    private final ImporterConfig config;
    private final AccountRepository accounts;
    private final TransactionRepository transactions;
    private final ImportRunRepository runs;
    private final Archiver archiver;
    private final TransactionValidator validator;
    private final ExecutorService workers;
    private final ScheduledExecutorService watchdog;
    private final Set<FileImportJob> active = ConcurrentHashMap.newKeySet();

    public TransactionImporter(ImporterConfig config, AccountRepository accounts,
                               TransactionRepository transactions, ImportRunRepository runs, Archiver archiver) {
        this.config = config;
        this.accounts = accounts;
        this.transactions = transactions;
        this.runs = runs;
        this.archiver = archiver;
        this.validator = new TransactionValidator(config.getFutureToleranceDays(), config.getMaxAbsAmount(),
                config.getClock());
        this.workers = Executors.newFixedThreadPool(config.getWorkerThreads(), daemonThreads("import-worker"));
        this.watchdog = Executors.newSingleThreadScheduledExecutor(daemonThreads("import-watchdog"));
    }

    public ImportRun importFile(Path file) {
        return importFiles(Collections.singletonList(file)).get(0);
    }

    /**
     * Imports files in parallel and waits for all of them.
     *
     * @return one finalized run per file, in input order
     */
    public List<ImportRun> importFiles(List<Path> files) {
        LOG.info("Starting import of {} file(s) with {} worker(s)", files.size(), config.getWorkerThreads());
        List<FileImportJob> jobs = new ArrayList<>();
        List<FutureTask<ImportRun>> tasks = new ArrayList<>();
        List<ImportRun> results = new ArrayList<>(Collections.nCopies(files.size(), (ImportRun) null));

        for (int i = 0; i < files.size(); i++) {
            Path file = files.get(i);
            ImportRun started = ImportRun.builder(UUID.randomUUID().toString(), file.toString(),
                    Instant.now(config.getClock())).stage(ImportStage.DETECTING).build();
            try {
                runs.start(started);
            } catch (StorageException e) {
                LOG.error("Cannot record start of {}", file, e);
                results.set(i, unrecorded(started, e));
                jobs.add(null);
                tasks.add(null);
                continue;
            }
            FileImportJob job = new FileImportJob(file, started, config, accounts, transactions, runs,
                    archiver, validator, watchdog);
            FutureTask<ImportRun> task = new FutureTask<>(job);
            job.bind(task);
            active.add(job);
            jobs.add(job);
            tasks.add(task);
            workers.execute(task);
        }

        for (int i = 0; i < files.size(); i++) {
            FileImportJob job = jobs.get(i);
            if (job == null) {
                continue;
            }
            results.set(i, await(job, tasks.get(i)));
            active.remove(job);
        }

        LOG.info("Import batch completed: {} file(s)", files.size());
        return results;
    }

    private ImportRun await(FileImportJob job, FutureTask<ImportRun> task) {
        try {
            return task.get();
        } catch (CancellationException e) {
            // abandoned by timeout or cancel(); the abandoning party finalized the run
            return job.awaitResult();
        } catch (ExecutionException e) {
            LOG.error("Import worker for {} died", job.getFile(), e.getCause());
            return job.failUnexpectedly(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            job.abandon(ImportErrorKind.CANCELLED, "Caller interrupted");
            return job.awaitResult();
        }
    }

    /**
     * Cancels every file of in-flight imports whose commit has not begun. Those files
     * are finalized as FAILED with nothing persisted; files already committing
     * complete normally.
     *
     * @return the number of files cancelled
     */
    public int cancel() {
        int cancelled = 0;
        for (FileImportJob job : active) {
            if (job.abandon(ImportErrorKind.CANCELLED, "Import cancelled")) {
                cancelled++;
            }
        }
        LOG.info("Cancelled {} in-flight file import(s)", cancelled);
        return cancelled;
    }

    private ImportRun unrecorded(ImportRun started, StorageException e) {
        return started.toBuilder()
                .outcome(ImportOutcome.FAILED)
                .stage(ImportStage.FAILED)
                .error(ImportErrorKind.STORAGE_ERROR, e.getMessage())
                .warning("Outcome not recorded: " + e.getMessage())
                .completedAt(Instant.now(config.getClock()))
                .build();
    }

    /**
     * Stops accepting work and waits briefly for running files to finish.
     */
    @Override
    public void close() {
        workers.shutdown();
        try {
            long waitMs = config.getFileTimeout().toMillis() + config.getLockTimeout().toMillis();
            if (!workers.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
                LOG.warn("Import workers still running after {} ms; forcing shutdown", waitMs);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            watchdog.shutdownNow();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
