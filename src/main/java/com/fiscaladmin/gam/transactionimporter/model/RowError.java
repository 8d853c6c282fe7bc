package com.fiscaladmin.gam.transactionimporter.model;

/**
 * A rejected row: the 1-based data row number (header excluded), the
 * rejection code and a human-readable message.
 */
public class RowError {

    private final int rowNumber;
    private final RowErrorCode code;
    private final String message;

    public RowError(int rowNumber, RowErrorCode code, String message) {
        this.rowNumber = rowNumber;
        this.code = code;
        this.message = message;
    }

    public int getRowNumber() {
        return rowNumber;
    }

    public RowErrorCode getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "Row " + rowNumber + ": " + code + " (" + message + ")";
    }
}
