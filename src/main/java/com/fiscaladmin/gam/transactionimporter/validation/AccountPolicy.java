package com.fiscaladmin.gam.transactionimporter.validation;

/**
 * What to do with a row whose account name does not match a stored account.
 */
public enum AccountPolicy {

    /** Create the account on first sight, with a zero balance. */
    AUTO_CREATE,

    /** Reject the row with {@code UNKNOWN_ACCOUNT}. */
    REJECT
}
