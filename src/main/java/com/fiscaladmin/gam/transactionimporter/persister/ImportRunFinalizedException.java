package com.fiscaladmin.gam.transactionimporter.persister;

/**
 * Thrown when an import run that has already been finalized is finalized again.
 */
public class ImportRunFinalizedException extends StorageException {

    private final String importRunId;

    public ImportRunFinalizedException(String importRunId) {
        super("Import run " + importRunId + " is already finalized");
        this.importRunId = importRunId;
    }

    public String getImportRunId() {
        return importRunId;
    }
}
