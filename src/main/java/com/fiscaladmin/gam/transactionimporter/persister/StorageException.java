package com.fiscaladmin.gam.transactionimporter.persister;

/**
 * Thrown for every persistence failure: SQL errors, constraint violations the
 * caller did not anticipate, and lock-acquisition timeouts. A failed commit has
 * been rolled back by the time this is thrown.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
