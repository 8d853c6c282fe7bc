package com.fiscaladmin.gam.transactionimporter.model;

/**
 * Final classification of one file import.
 * <ul>
 *   <li>{@code SUCCEEDED}: committed and archived, no invalid rows</li>
 *   <li>{@code PARTIALLY_SUCCEEDED}: committed, but some rows were invalid (possibly
 *       all of them, leaving nothing to insert) or the file could not be archived</li>
 *   <li>{@code FAILED}: a file-level error; nothing committed</li>
 * </ul>
 * Duplicate rows never degrade the outcome: re-importing a file is a success.
 */
public enum ImportOutcome {
    SUCCEEDED,
    PARTIALLY_SUCCEEDED,
    FAILED
}
