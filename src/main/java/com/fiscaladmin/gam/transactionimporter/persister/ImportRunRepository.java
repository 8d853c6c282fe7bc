package com.fiscaladmin.gam.transactionimporter.persister;

import com.fiscaladmin.gam.transactionimporter.model.ImportErrorKind;
import com.fiscaladmin.gam.transactionimporter.model.ImportOutcome;
import com.fiscaladmin.gam.transactionimporter.model.ImportRun;
import com.fiscaladmin.gam.transactionimporter.model.ImportStage;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Storage for {@link ImportRun} metadata. A run is inserted when a file is picked up
 * and finalized exactly once; the {@code completed_at IS NULL} guard on the update
 * makes a second finalization fail instead of overwriting the first.
 * <p>
 * Row error details are returned to the caller of the import but not stored; only
 * the counters are.
 */
public class ImportRunRepository {

    private static final String SELECT_COLUMNS = "SELECT id, source_path, profile_id, started_at, completed_at, "
            + "outcome, stage, error_kind, error_message, warning, archived_path, "
            + "rows_seen, rows_imported, rows_duplicate, rows_invalid FROM import_runs";

    private final DataSource dataSource;

    public ImportRunRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Inserts a run that has started but not completed.
     */
    public void start(ImportRun run) {
        try (Connection con = dataSource.getConnection();
             PreparedStatement ps = con.prepareStatement(
                     "INSERT INTO import_runs (id, source_path, started_at, stage) VALUES (?, ?, ?, ?)")) {
            ps.setString(1, run.getId());
            ps.setString(2, run.getSourcePath());
            ps.setTimestamp(3, Timestamp.from(run.getStartedAt()));
            ps.setString(4, name(run.getStage()));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Cannot record start of import " + run.getSourcePath() + ": "
                    + e.getMessage(), e);
        }
    }

    /**
     * Writes the final state of a run.
     *
     * @throws ImportRunFinalizedException if the run was already finalized
     * @throws IllegalArgumentException    if the run has no completion time or outcome
     */
    public void complete(ImportRun run) {
        if (run.getCompletedAt() == null || run.getOutcome() == null) {
            throw new IllegalArgumentException("Run " + run.getId() + " has no completion time or outcome");
        }
        int updated;
        try (Connection con = dataSource.getConnection();
             PreparedStatement ps = con.prepareStatement("UPDATE import_runs SET profile_id = ?, completed_at = ?, "
                     + "outcome = ?, stage = ?, error_kind = ?, error_message = ?, warning = ?, archived_path = ?, "
                     + "rows_seen = ?, rows_imported = ?, rows_duplicate = ?, rows_invalid = ? "
                     + "WHERE id = ? AND completed_at IS NULL")) {
            ps.setString(1, run.getProfileId());
            ps.setTimestamp(2, Timestamp.from(run.getCompletedAt()));
            ps.setString(3, name(run.getOutcome()));
            ps.setString(4, name(run.getStage()));
            ps.setString(5, name(run.getErrorKind()));
            ps.setString(6, truncate(run.getErrorMessage()));
            ps.setString(7, truncate(run.getWarning()));
            ps.setString(8, run.getArchivedPath());
            ps.setInt(9, run.getRowsSeen());
            ps.setInt(10, run.getRowsImported());
            ps.setInt(11, run.getRowsDuplicate());
            ps.setInt(12, run.getRowsInvalid());
            ps.setString(13, run.getId());
            updated = ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Cannot finalize import run " + run.getId() + ": " + e.getMessage(), e);
        }
        if (updated == 0) {
            if (findById(run.getId()).isPresent()) {
                throw new ImportRunFinalizedException(run.getId());
            }
            throw new IllegalArgumentException("No import run with id " + run.getId());
        }
    }

    public Optional<ImportRun> findById(String id) {
        try (Connection con = dataSource.getConnection();
             PreparedStatement ps = con.prepareStatement(SELECT_COLUMNS + " WHERE id = ?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(read(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Cannot read import run " + id + ": " + e.getMessage(), e);
        }
    }

    /**
     * Returns the processing history, most recent first.
     */
    public List<ImportRun> listAll() {
        List<ImportRun> runs = new ArrayList<>();
        try (Connection con = dataSource.getConnection();
             PreparedStatement ps = con.prepareStatement(SELECT_COLUMNS + " ORDER BY started_at DESC, id");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                runs.add(read(rs));
            }
        } catch (SQLException e) {
            throw new StorageException("Cannot list import runs: " + e.getMessage(), e);
        }
        return runs;
    }

    private static ImportRun read(ResultSet rs) throws SQLException {
        ImportRun.Builder b = ImportRun.builder(
                rs.getString("id"), rs.getString("source_path"), rs.getTimestamp("started_at").toInstant());
        Timestamp completedAt = rs.getTimestamp("completed_at");
        String outcome = rs.getString("outcome");
        String stage = rs.getString("stage");
        String errorKind = rs.getString("error_kind");
        return b.profileId(rs.getString("profile_id"))
                .completedAt(completedAt != null ? completedAt.toInstant() : null)
                .outcome(outcome != null ? ImportOutcome.valueOf(outcome) : null)
                .stage(stage != null ? ImportStage.valueOf(stage) : null)
                .error(errorKind != null ? ImportErrorKind.valueOf(errorKind) : null, rs.getString("error_message"))
                .warning(rs.getString("warning"))
                .archivedPath(rs.getString("archived_path"))
                .rowsSeen(rs.getInt("rows_seen"))
                .rowsImported(rs.getInt("rows_imported"))
                .rowsDuplicate(rs.getInt("rows_duplicate"))
                .rowsInvalid(rs.getInt("rows_invalid"))
                .build();
    }

    private static String name(Enum<?> value) {
        return value != null ? value.name() : null;
    }

    private static String truncate(String s) {
        return s != null && s.length() > 2048 ? s.substring(0, 2048) : s;
    }
}
