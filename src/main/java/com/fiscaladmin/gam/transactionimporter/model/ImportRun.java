package com.fiscaladmin.gam.transactionimporter.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Audit record of one file import. A run is inserted when processing of the
 * file begins and finalized exactly once; after that it never changes.
 * <p>
 * {@code rowErrors} is only populated on runs returned from an import call;
 * runs read back from the store carry the counters only.
 */
public class ImportRun {

    private final String id;
    private final String sourcePath;
    private final String profileId;
    private final Instant startedAt;
    private final Instant completedAt;
    private final ImportOutcome outcome;
    private final ImportStage stage;
    private final ImportErrorKind errorKind;
    private final String errorMessage;
    private final String warning;
    private final String archivedPath;
    private final int rowsSeen;
    private final int rowsImported;
    private final int rowsDuplicate;
    private final int rowsInvalid;
    private final List<RowError> rowErrors;

    private ImportRun(Builder b) {
        this.id = b.id;
        this.sourcePath = b.sourcePath;
        this.profileId = b.profileId;
        this.startedAt = b.startedAt;
        this.completedAt = b.completedAt;
        this.outcome = b.outcome;
        this.stage = b.stage;
        this.errorKind = b.errorKind;
        this.errorMessage = b.errorMessage;
        this.warning = b.warning;
        this.archivedPath = b.archivedPath;
        this.rowsSeen = b.rowsSeen;
        this.rowsImported = b.rowsImported;
        this.rowsDuplicate = b.rowsDuplicate;
        this.rowsInvalid = b.rowsInvalid;
        this.rowErrors = Collections.unmodifiableList(new ArrayList<>(b.rowErrors));
    }

    public static Builder builder(String id, String sourcePath, Instant startedAt) {
        return new Builder(id, sourcePath, startedAt);
    }

    public Builder toBuilder() {
        Builder b = new Builder(id, sourcePath, startedAt);
        b.profileId = profileId;
        b.completedAt = completedAt;
        b.outcome = outcome;
        b.stage = stage;
        b.errorKind = errorKind;
        b.errorMessage = errorMessage;
        b.warning = warning;
        b.archivedPath = archivedPath;
        b.rowsSeen = rowsSeen;
        b.rowsImported = rowsImported;
        b.rowsDuplicate = rowsDuplicate;
        b.rowsInvalid = rowsInvalid;
        b.rowErrors.addAll(rowErrors);
        return b;
    }

    public String getId() {
        return id;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    /**
     * Returns the detected bank profile id, or {@code null} if detection did not succeed.
     */
    public String getProfileId() {
        return profileId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public boolean isFinalized() {
        return completedAt != null;
    }

    public ImportOutcome getOutcome() {
        return outcome;
    }

    /**
     * Returns {@link ImportStage#DONE} for committed files, otherwise the stage
     * in which the file failed.
     */
    public ImportStage getStage() {
        return stage;
    }

    public ImportErrorKind getErrorKind() {
        return errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getWarning() {
        return warning;
    }

    public String getArchivedPath() {
        return archivedPath;
    }

    public int getRowsSeen() {
        return rowsSeen;
    }

    public int getRowsImported() {
        return rowsImported;
    }

    public int getRowsDuplicate() {
        return rowsDuplicate;
    }

    public int getRowsInvalid() {
        return rowsInvalid;
    }

    public List<RowError> getRowErrors() {
        return rowErrors;
    }

    @Override
    public String toString() {
        return "ImportRun{" + sourcePath + ", profile=" + profileId + ", outcome=" + outcome
                + ", stage=" + stage + ", seen=" + rowsSeen + ", imported=" + rowsImported
                + ", duplicates=" + rowsDuplicate + ", invalid=" + rowsInvalid
                + (errorMessage != null ? ", error=" + errorMessage : "")
                + (warning != null ? ", warning=" + warning : "") + "}";
    }

    public static class Builder {

        private final String id;
        private final String sourcePath;
        private final Instant startedAt;
        private String profileId;
        private Instant completedAt;
        private ImportOutcome outcome;
        private ImportStage stage;
        private ImportErrorKind errorKind;
        private String errorMessage;
        private String warning;
        private String archivedPath;
        private int rowsSeen;
        private int rowsImported;
        private int rowsDuplicate;
        private int rowsInvalid;
        private final List<RowError> rowErrors = new ArrayList<>();

        private Builder(String id, String sourcePath, Instant startedAt) {
            this.id = id;
            this.sourcePath = sourcePath;
            this.startedAt = startedAt;
        }

        public Builder profileId(String profileId) {
            this.profileId = profileId;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder outcome(ImportOutcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder stage(ImportStage stage) {
            this.stage = stage;
            return this;
        }

        public Builder error(ImportErrorKind kind, String message) {
            this.errorKind = kind;
            this.errorMessage = message;
            return this;
        }

        public Builder warning(String warning) {
            this.warning = warning;
            return this;
        }

        public Builder archivedPath(String archivedPath) {
            this.archivedPath = archivedPath;
            return this;
        }

        public Builder rowsSeen(int rowsSeen) {
            this.rowsSeen = rowsSeen;
            return this;
        }

        public Builder rowsImported(int rowsImported) {
            this.rowsImported = rowsImported;
            return this;
        }

        public Builder rowsDuplicate(int rowsDuplicate) {
            this.rowsDuplicate = rowsDuplicate;
            return this;
        }

        public Builder rowsInvalid(int rowsInvalid) {
            this.rowsInvalid = rowsInvalid;
            return this;
        }

        public Builder rowErrors(List<RowError> errors) {
            this.rowErrors.clear();
            this.rowErrors.addAll(errors);
            return this;
        }

        public ImportRun build() {
            return new ImportRun(this);
        }
    }
}
