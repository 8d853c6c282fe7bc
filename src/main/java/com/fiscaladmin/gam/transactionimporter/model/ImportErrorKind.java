package com.fiscaladmin.gam.transactionimporter.model;

/**
 * File-level problem categories recorded on an {@link ImportRun}.
 * Only {@link #ARCHIVE_ERROR} is compatible with a committed file.
 */
public enum ImportErrorKind {
    FILE_ERROR,
    STORAGE_ERROR,
    TIMEOUT,
    CANCELLED,
    ARCHIVE_ERROR
}
