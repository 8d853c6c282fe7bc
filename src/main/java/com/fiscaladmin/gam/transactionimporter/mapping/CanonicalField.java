package com.fiscaladmin.gam.transactionimporter.mapping;

/**
 * Canonical transaction fields a bank column can be mapped to.
 */
public enum CanonicalField {
    POSTED_DATE,
    DESCRIPTION,
    /** Signed amount, or an unsigned amount whose sign comes from {@link #TYPE}. */
    AMOUNT,
    /** Money out, for banks that split debits and credits into two columns. */
    DEBIT,
    /** Money in, for banks that split debits and credits into two columns. */
    CREDIT,
    /** Transaction type label ("Sale", "Payment", ...) deciding the sign of {@link #AMOUNT}. */
    TYPE,
    /** Extra memo text appended to the description. */
    MEMO,
    CATEGORY,
    /** Per-row account name overriding the profile default. */
    ACCOUNT
}
