package com.fiscaladmin.gam.transactionimporter.config;

import com.fiscaladmin.gam.transactionimporter.mapping.BankProfile;
import com.fiscaladmin.gam.transactionimporter.mapping.BankProfiles;
import com.fiscaladmin.gam.transactionimporter.validation.AccountPolicy;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable settings for the importer. Built once, passed to the orchestrator and
 * the store, never mutated.
 *
 * @see ImporterConfigLoader
 */
public class ImporterConfig {

    public static final String DEFAULT_JDBC_URL = "jdbc:h2:./data/transactions";
    public static final String DEFAULT_ARCHIVE_ROOT = "csv_files/csv_files_added";

    private final String jdbcUrl;
    private final String jdbcUser;
    private final String jdbcPassword;
    private final Path archiveRoot;
    private final int workerThreads;
    private final Duration fileTimeout;
    private final Duration lockTimeout;
    private final int futureToleranceDays;
    private final BigDecimal maxAbsAmount;
    private final AccountPolicy accountPolicy;
    private final int archiveAttempts;
    private final List<BankProfile> profiles;
    private final Clock clock;

    private ImporterConfig(Builder b) {
        this.jdbcUrl = b.jdbcUrl;
        this.jdbcUser = b.jdbcUser;
        this.jdbcPassword = b.jdbcPassword;
        this.archiveRoot = b.archiveRoot;
        this.workerThreads = b.workerThreads;
        this.fileTimeout = b.fileTimeout;
        this.lockTimeout = b.lockTimeout;
        this.futureToleranceDays = b.futureToleranceDays;
        this.maxAbsAmount = b.maxAbsAmount;
        this.accountPolicy = b.accountPolicy;
        this.archiveAttempts = b.archiveAttempts;
        this.profiles = Collections.unmodifiableList(new ArrayList<>(b.profiles));
        this.clock = b.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ImporterConfig defaults() {
        return builder().build();
    }

    public Builder toBuilder() {
        return new Builder()
                .jdbc(jdbcUrl, jdbcUser, jdbcPassword)
                .archiveRoot(archiveRoot)
                .workerThreads(workerThreads)
                .fileTimeout(fileTimeout)
                .lockTimeout(lockTimeout)
                .futureToleranceDays(futureToleranceDays)
                .maxAbsAmount(maxAbsAmount)
                .accountPolicy(accountPolicy)
                .archiveAttempts(archiveAttempts)
                .profiles(profiles)
                .clock(clock);
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public String getJdbcUser() {
        return jdbcUser;
    }

    public String getJdbcPassword() {
        return jdbcPassword;
    }

    public Path getArchiveRoot() {
        return archiveRoot;
    }

    /**
     * Number of files imported in parallel.
     */
    public int getWorkerThreads() {
        return workerThreads;
    }

    /**
     * Wall-clock limit for one file, from pick-up to archive.
     */
    public Duration getFileTimeout() {
        return fileTimeout;
    }

    /**
     * How long a commit waits for an account lock before failing.
     */
    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public int getFutureToleranceDays() {
        return futureToleranceDays;
    }

    public BigDecimal getMaxAbsAmount() {
        return maxAbsAmount;
    }

    public AccountPolicy getAccountPolicy() {
        return accountPolicy;
    }

    public int getArchiveAttempts() {
        return archiveAttempts;
    }

    /**
     * Profiles in detection order.
     */
    public List<BankProfile> getProfiles() {
        return profiles;
    }

    public Clock getClock() {
        return clock;
    }

    public static class Builder {

        private String jdbcUrl = DEFAULT_JDBC_URL;
        private String jdbcUser = "sa";
        private String jdbcPassword = "";
        private Path archiveRoot = Paths.get(DEFAULT_ARCHIVE_ROOT);
        private int workerThreads = 4;
        private Duration fileTimeout = Duration.ofSeconds(60);
        private Duration lockTimeout = Duration.ofSeconds(10);
        private int futureToleranceDays = 1;
        private BigDecimal maxAbsAmount = new BigDecimal("50000");
        private AccountPolicy accountPolicy = AccountPolicy.AUTO_CREATE;
        private int archiveAttempts = 3;
        private List<BankProfile> profiles = BankProfiles.ALL;
        private Clock clock = Clock.systemDefaultZone();

        private Builder() {
        }

        public Builder jdbc(String url, String user, String password) {
            this.jdbcUrl = url;
            this.jdbcUser = user;
            this.jdbcPassword = password;
            return this;
        }

        public Builder archiveRoot(Path archiveRoot) {
            this.archiveRoot = archiveRoot;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder fileTimeout(Duration fileTimeout) {
            this.fileTimeout = fileTimeout;
            return this;
        }

        public Builder lockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
            return this;
        }

        public Builder futureToleranceDays(int days) {
            this.futureToleranceDays = days;
            return this;
        }

        public Builder maxAbsAmount(BigDecimal maxAbsAmount) {
            this.maxAbsAmount = maxAbsAmount;
            return this;
        }

        public Builder accountPolicy(AccountPolicy accountPolicy) {
            this.accountPolicy = accountPolicy;
            return this;
        }

        public Builder archiveAttempts(int attempts) {
            this.archiveAttempts = attempts;
            return this;
        }

        public Builder profiles(List<BankProfile> profiles) {
            this.profiles = profiles;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a setting is missing or out of range
         */
        public ImporterConfig build() {
            if (jdbcUrl == null || jdbcUrl.trim().isEmpty()) {
                throw new IllegalArgumentException("jdbcUrl is required");
            }
            if (archiveRoot == null) {
                throw new IllegalArgumentException("archiveRoot is required");
            }
            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be at least 1");
            }
            requirePositive(fileTimeout, "fileTimeout");
            requirePositive(lockTimeout, "lockTimeout");
            if (futureToleranceDays < 0) {
                throw new IllegalArgumentException("futureToleranceDays must not be negative");
            }
            if (maxAbsAmount == null || maxAbsAmount.signum() <= 0) {
                throw new IllegalArgumentException("maxAbsAmount must be positive");
            }
            if (accountPolicy == null) {
                throw new IllegalArgumentException("accountPolicy is required");
            }
            if (archiveAttempts < 1) {
                throw new IllegalArgumentException("archiveAttempts must be at least 1");
            }
            if (profiles == null || profiles.isEmpty()) {
                throw new IllegalArgumentException("at least one bank profile is required");
            }
            if (clock == null) {
                throw new IllegalArgumentException("clock is required");
            }
            return new ImporterConfig(this);
        }

        private static void requirePositive(Duration d, String name) {
            if (d == null || d.isZero() || d.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }
    }
}
